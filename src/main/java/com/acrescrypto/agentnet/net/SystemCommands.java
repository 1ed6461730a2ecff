package com.acrescrypto.agentnet.net;

import java.io.IOException;
import java.util.Map;

import com.acrescrypto.agentnet.messages.Envelope;

/** Control-plane command names. These strings are part of the wire contract. */
public class SystemCommands {
	public final static String REGISTER_AGENT        = "register_agent";
	public final static String LIST_AGENTS           = "list_agents";
	public final static String LIST_PROTOCOLS        = "list_protocols";
	public final static String GET_PROTOCOL_MANIFEST = "get_protocol_manifest";
	
	public static void sendSystemRequest(AgentSocket socket, String command, Map<String,?> params) throws IOException {
		socket.write(Envelope.systemRequest(command, params).toJson());
	}
}
