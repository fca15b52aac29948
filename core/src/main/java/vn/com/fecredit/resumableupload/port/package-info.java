/**
 * Ports through which the upload engine reaches its collaborators.
 * In a Ports and Adapters architecture, ports are interfaces that define
 * how the application core interacts with external systems: here the record
 * store that persists upload state and the blob sink that holds the bytes.
 */
package vn.com.fecredit.resumableupload.port;
