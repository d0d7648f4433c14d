/**
 * Declarative settings schema: field specifications, types and validators.
 */
package fr.lapetina.sct.chatbot.infrastructure.config.schema;
