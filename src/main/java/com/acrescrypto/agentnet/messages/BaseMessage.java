package com.acrescrypto.agentnet.messages;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import com.acrescrypto.agentnet.utility.Util;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Application-level message. Subclasses are distinguished on the wire by {@code message_type}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class BaseMessage {
	protected String messageId = UUID.randomUUID().toString();
	protected long timestamp = Util.currentTimeMillis();
	protected String senderId;
	protected Map<String,Object> metadata = new HashMap<>();
	protected Map<String,Object> content = new HashMap<>();
	protected String textRepresentation;
	protected boolean requiresResponse;
	
	protected BaseMessage() {
	}
	
	protected BaseMessage(String senderId, Map<String,Object> content) {
		this.senderId = senderId;
		if(content != null) this.content = content;
	}
	
	@JsonProperty(value = "message_type", access = JsonProperty.Access.READ_ONLY)
	public abstract String getMessageType();

	public String getMessageId() {
		return messageId;
	}

	public void setMessageId(String messageId) {
		this.messageId = messageId;
	}

	public long getTimestamp() {
		return timestamp;
	}

	public void setTimestamp(long timestamp) {
		this.timestamp = timestamp;
	}

	public String getSenderId() {
		return senderId;
	}

	public void setSenderId(String senderId) {
		this.senderId = senderId;
	}

	public Map<String,Object> getMetadata() {
		return metadata;
	}

	public void setMetadata(Map<String,Object> metadata) {
		this.metadata = metadata == null ? new HashMap<>() : metadata;
	}

	public Map<String,Object> getContent() {
		return content;
	}

	public void setContent(Map<String,Object> content) {
		this.content = content == null ? new HashMap<>() : content;
	}

	public String getTextRepresentation() {
		return textRepresentation;
	}

	public void setTextRepresentation(String textRepresentation) {
		this.textRepresentation = textRepresentation;
	}

	public boolean isRequiresResponse() {
		return requiresResponse;
	}

	public void setRequiresResponse(boolean requiresResponse) {
		this.requiresResponse = requiresResponse;
	}
	
	@Override
	public String toString() {
		return getClass().getSimpleName() + "[" + messageId + " from " + senderId + "]";
	}
}
