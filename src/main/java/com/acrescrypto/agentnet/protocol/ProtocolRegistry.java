package com.acrescrypto.agentnet.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.agentnet.exceptions.ProtocolRegistrationException;
import com.acrescrypto.agentnet.messages.BaseMessage;
import com.acrescrypto.agentnet.messages.BroadcastMessage;
import com.acrescrypto.agentnet.messages.DirectMessage;
import com.acrescrypto.agentnet.messages.ProtocolMessage;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Network-side home of the protocols attached to one network. Protocols are registered once, in order;
 * messages pass through them in that order.
 */
public class ProtocolRegistry {
	private final Logger logger = LoggerFactory.getLogger(ProtocolRegistry.class);
	
	protected final OutboundSender network;
	protected final LinkedHashMap<String,NetworkProtocol> protocols = new LinkedHashMap<>();
	
	public ProtocolRegistry(OutboundSender network) {
		this.network = network;
	}
	
	public synchronized void registerProtocol(NetworkProtocol protocol) throws ProtocolRegistrationException {
		String name = protocol.getName();
		if(protocols.containsKey(name)) {
			throw new ProtocolRegistrationException(name, "already registered with network " + network.getNetworkId());
		}
		
		if(!protocol.registerWithNetwork(network)) {
			throw new ProtocolRegistrationException(name, "refused network " + network.getNetworkId());
		}
		
		if(!protocol.initialize()) {
			throw new ProtocolRegistrationException(name, "failed to initialize");
		}
		
		protocols.put(name, protocol);
		logger.info("Network {}: Registered protocol {}", network.getNetworkId(), name);
	}
	
	public synchronized NetworkProtocol getProtocol(String name) {
		return protocols.get(name);
	}
	
	public synchronized List<String> listProtocols() {
		return Collections.unmodifiableList(new ArrayList<>(protocols.keySet()));
	}
	
	protected synchronized List<NetworkProtocol> snapshot() {
		return new ArrayList<>(protocols.values());
	}
	
	/** @return true only if every protocol accepted the agent */
	public boolean registerAgent(String agentId, Map<String,Object> metadata) {
		boolean success = true;
		for(NetworkProtocol protocol : snapshot()) {
			if(!protocol.registerAgent(agentId, metadata)) {
				logger.warn("Network {}: Protocol {} refused agent {}", network.getNetworkId(), protocol.getName(), agentId);
				success = false;
			}
		}
		
		return success;
	}
	
	public boolean unregisterAgent(String agentId) {
		boolean success = true;
		for(NetworkProtocol protocol : snapshot()) {
			success &= protocol.unregisterAgent(agentId);
		}
		
		return success;
	}
	
	/**
	 * Run a message through the protocol pipeline. Direct and broadcast messages pass through every
	 * protocol in registration order, each seeing the previous one's output; a protocol returning null
	 * consumes the message. Protocol messages go only to the protocol they name.
	 *
	 * @return the message to deliver onward, or null if nothing should be delivered
	 */
	public BaseMessage routeMessage(BaseMessage message) {
		if(message instanceof DirectMessage) {
			DirectMessage direct = (DirectMessage) message;
			for(NetworkProtocol protocol : snapshot()) {
				direct = protocol.processDirectMessage(direct);
				if(direct == null) return null;
			}
			
			return direct;
		} else if(message instanceof BroadcastMessage) {
			BroadcastMessage broadcast = (BroadcastMessage) message;
			for(NetworkProtocol protocol : snapshot()) {
				broadcast = protocol.processBroadcastMessage(broadcast);
				if(broadcast == null) return null;
			}
			
			return broadcast;
		} else if(message instanceof ProtocolMessage) {
			ProtocolMessage protocolMessage = (ProtocolMessage) message;
			NetworkProtocol protocol = getProtocol(protocolMessage.getProtocol());
			if(protocol == null) {
				logger.debug("Network {}: No protocol {} for message {}",
						network.getNetworkId(),
						protocolMessage.getProtocol(),
						message.getMessageId());
				return null;
			}
			
			protocol.processProtocolMessage(protocolMessage);
			return null;
		}
		
		return message;
	}
	
	/** Hand raw protocol-addressed input to the named protocol's generic handler. */
	public Optional<JsonNode> handleMessage(String protocolName, JsonNode message) {
		NetworkProtocol protocol = getProtocol(protocolName);
		if(protocol == null) return Optional.empty();
		return protocol.handleMessage(message);
	}
	
	public Map<String,Map<String,Object>> getState() {
		LinkedHashMap<String,Map<String,Object>> state = new LinkedHashMap<>();
		for(NetworkProtocol protocol : snapshot()) {
			state.put(protocol.getName(), protocol.getState());
		}
		
		return state;
	}
	
	/** Shut every protocol down, most recently registered first, and forget them. */
	public boolean shutdown() {
		List<NetworkProtocol> all = snapshot();
		Collections.reverse(all);
		
		boolean success = true;
		for(NetworkProtocol protocol : all) {
			try {
				success &= protocol.shutdown();
			} catch(RuntimeException exc) {
				logger.error("Network {}: Protocol {} failed to shut down", network.getNetworkId(), protocol.getName(), exc);
				success = false;
			}
		}
		
		synchronized(this) {
			protocols.clear();
		}
		
		return success;
	}
}
