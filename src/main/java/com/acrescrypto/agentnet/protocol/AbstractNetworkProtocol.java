package com.acrescrypto.agentnet.protocol;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

/** Shared bookkeeping for protocols: name, active-agent membership and the network back-reference. */
public abstract class AbstractNetworkProtocol implements NetworkProtocol {
	protected final Logger logger = LoggerFactory.getLogger(getClass());
	protected final String name;
	protected final Set<String> activeAgents = ConcurrentHashMap.newKeySet();
	protected volatile OutboundSender network;
	
	protected AbstractNetworkProtocol(String name) {
		this.name = name == null ? getClass().getSimpleName() : name;
		logger.info("Protocol {}: Initializing network protocol", this.name);
	}
	
	@Override
	public String getName() {
		return name;
	}
	
	@Override
	public boolean initialize() {
		return true;
	}
	
	@Override
	public synchronized boolean registerWithNetwork(OutboundSender network) {
		if(this.network != null) {
			logger.warn("Protocol {}: Already registered with network {}, refusing {}",
					name,
					this.network.getNetworkId(),
					network.getNetworkId());
			return false;
		}
		
		this.network = network;
		logger.info("Protocol {}: Registered with network {}", name, network.getNetworkId());
		return true;
	}
	
	@Override
	public boolean registerAgent(String agentId, Map<String,Object> metadata) {
		activeAgents.add(agentId);
		logger.info("Protocol {}: Registered agent {}", name, agentId);
		return true;
	}
	
	@Override
	public boolean unregisterAgent(String agentId) {
		if(activeAgents.remove(agentId)) {
			logger.info("Protocol {}: Unregistered agent {}", name, agentId);
		}
		
		return true;
	}
	
	@Override
	public Optional<JsonNode> handleMessage(JsonNode message) {
		logger.debug("Protocol {}: Handling message {}", name, message);
		return Optional.empty();
	}
	
	public Set<String> getActiveAgents() {
		return Collections.unmodifiableSet(activeAgents);
	}
	
	public OutboundSender getNetwork() {
		return network;
	}
}
