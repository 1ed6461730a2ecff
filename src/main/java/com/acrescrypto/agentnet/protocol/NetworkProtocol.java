package com.acrescrypto.agentnet.protocol;

import java.util.Map;
import java.util.Optional;

import com.acrescrypto.agentnet.messages.BroadcastMessage;
import com.acrescrypto.agentnet.messages.DirectMessage;
import com.acrescrypto.agentnet.messages.ProtocolMessage;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A pluggable network-level module. A network registers each protocol once, hands it an
 * {@link OutboundSender}, then feeds it agent membership changes and messages.
 */
public interface NetworkProtocol {
	/** Unique within one network. */
	String getName();
	
	boolean initialize();
	
	/** Release everything this protocol owns. Safe to call more than once. */
	boolean shutdown();
	
	boolean registerAgent(String agentId, Map<String,Object> metadata);
	
	/** Unregistering an agent that was never registered is a no-op and still succeeds. */
	boolean unregisterAgent(String agentId);
	
	/** Entry point for protocol-addressed input that none of the typed hooks cover. */
	Optional<JsonNode> handleMessage(JsonNode message);
	
	/** Diagnostic snapshot. Must not change any state. */
	Map<String,Object> getState();
	
	/** Store the network back-reference. Accepted once; later calls return false. */
	boolean registerWithNetwork(OutboundSender network);
	
	default DirectMessage processDirectMessage(DirectMessage message) {
		return message;
	}
	
	default BroadcastMessage processBroadcastMessage(BroadcastMessage message) {
		return message;
	}
	
	default void processProtocolMessage(ProtocolMessage message) {
	}
}
