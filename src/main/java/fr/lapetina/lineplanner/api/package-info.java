/**
 * HTTP API exposing layout generation as JSON.
 *
 * @see fr.lapetina.lineplanner.api.HttpServer
 */
package fr.lapetina.lineplanner.api;
