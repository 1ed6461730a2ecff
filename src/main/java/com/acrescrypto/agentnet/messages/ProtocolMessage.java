package com.acrescrypto.agentnet.messages;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Message addressed to a named protocol module rather than to an agent. The {@code action} entry of the
 * content selects what the protocol does with it.
 * 
 * Direction and relevant agent are hop-local: the sending side marks them outbound when the message
 * leaves, the receiving side marks them inbound when it is consumed.
 */
public class ProtocolMessage extends BaseMessage {
	public final static String MESSAGE_TYPE = "protocol_message";
	
	public enum Direction {
		@JsonProperty("inbound") INBOUND,
		@JsonProperty("outbound") OUTBOUND
	}
	
	protected String protocol;
	protected Direction direction;
	protected String relevantAgentId;
	
	public ProtocolMessage() {
	}
	
	public ProtocolMessage(String senderId, String protocol, Map<String,Object> content) {
		super(senderId, content);
		this.protocol = protocol;
	}
	
	public ProtocolMessage(String senderId, String protocol, Map<String,Object> content, Direction direction, String relevantAgentId) {
		this(senderId, protocol, content);
		this.direction = direction;
		this.relevantAgentId = relevantAgentId;
	}
	
	@Override
	public String getMessageType() {
		return MESSAGE_TYPE;
	}
	
	/** Stamp the per-hop routing fields in one step. */
	public void markHop(Direction direction, String relevantAgentId) {
		this.direction = direction;
		this.relevantAgentId = relevantAgentId;
	}
	
	@JsonIgnore
	public String getAction() {
		Object action = content.get("action");
		return action instanceof String ? (String) action : "";
	}

	public String getProtocol() {
		return protocol;
	}

	public void setProtocol(String protocol) {
		this.protocol = protocol;
	}

	public Direction getDirection() {
		return direction;
	}

	public void setDirection(Direction direction) {
		this.direction = direction;
	}

	public String getRelevantAgentId() {
		return relevantAgentId;
	}

	public void setRelevantAgentId(String relevantAgentId) {
		this.relevantAgentId = relevantAgentId;
	}
}
