package com.acrescrypto.agentnet.messages;

import java.util.Map;

public class DirectMessage extends BaseMessage {
	public final static String MESSAGE_TYPE = "direct_message";
	
	protected String targetAgentId;
	
	public DirectMessage() {
	}
	
	public DirectMessage(String senderId, String targetAgentId, Map<String,Object> content) {
		super(senderId, content);
		this.targetAgentId = targetAgentId;
	}
	
	@Override
	public String getMessageType() {
		return MESSAGE_TYPE;
	}

	public String getTargetAgentId() {
		return targetAgentId;
	}

	public void setTargetAgentId(String targetAgentId) {
		this.targetAgentId = targetAgentId;
	}
}
