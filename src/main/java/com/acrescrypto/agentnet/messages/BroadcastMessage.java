package com.acrescrypto.agentnet.messages;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class BroadcastMessage extends BaseMessage {
	public final static String MESSAGE_TYPE = "broadcast_message";
	
	protected List<String> excludeAgentIds = new ArrayList<>();
	
	public BroadcastMessage() {
	}
	
	public BroadcastMessage(String senderId, Map<String,Object> content) {
		super(senderId, content);
	}
	
	@Override
	public String getMessageType() {
		return MESSAGE_TYPE;
	}

	public List<String> getExcludeAgentIds() {
		return excludeAgentIds;
	}

	public void setExcludeAgentIds(List<String> excludeAgentIds) {
		this.excludeAgentIds = excludeAgentIds == null ? new ArrayList<>() : excludeAgentIds;
	}
}
