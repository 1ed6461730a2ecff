package com.acrescrypto.agentnet.protocol;

import com.acrescrypto.agentnet.messages.ProtocolMessage;

/** The slice of a network that a protocol may use: its identity, and a way to send responses out. */
public interface OutboundSender {
	String getNetworkId();
	boolean sendProtocolMessage(ProtocolMessage message);
}
