package com.tomaszrup.lspdaemon;

/**
 * JSON-RPC method names used by the daemon client.
 */
public final class Protocol {

	private Protocol() {
	}

	public static final String JSONRPC_VERSION = "2.0";

	public static final String REQUEST_INITIALIZE = "initialize";
	public static final String REQUEST_WORKSPACE_CONFIGURATION = "workspace/configuration";

	public static final String NOTIFICATION_INITIALIZED = "initialized";
	public static final String NOTIFICATION_DID_OPEN = "textDocument/didOpen";
	public static final String NOTIFICATION_DID_CHANGE = "textDocument/didChange";
	public static final String NOTIFICATION_PUBLISH_DIAGNOSTICS = "textDocument/publishDiagnostics";
}
