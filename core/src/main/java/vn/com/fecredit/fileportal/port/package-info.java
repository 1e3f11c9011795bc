/**
 * Ports through which the upload engine reaches persistence. The server implements them
 * with Spring Data repositories; {@code port.impl} holds in-memory versions for embedding
 * the engine without a database.
 */
package vn.com.fecredit.fileportal.port;
