package com.acrescrypto.agentnet.messages;

import java.util.HashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.agentnet.utility.Util;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

public class MessageParser {
	protected final static HashMap<String,Class<? extends BaseMessage>> types = new HashMap<>();
	private final static Logger logger = LoggerFactory.getLogger(MessageParser.class);
	
	static {
		types.put(DirectMessage.MESSAGE_TYPE,    DirectMessage.class);
		types.put(BroadcastMessage.MESSAGE_TYPE, BroadcastMessage.class);
		types.put(ProtocolMessage.MESSAGE_TYPE,  ProtocolMessage.class);
	}
	
	public static boolean isKnownType(String messageType) {
		return messageType != null && types.containsKey(messageType);
	}
	
	/** Build the typed message for a {@code data} object. Returns null for message types we don't know. */
	public static BaseMessage parse(JsonNode data) throws JsonProcessingException {
		if(data == null || !data.isObject()) return null;
		
		JsonNode typeNode = data.get("message_type");
		String messageType = typeNode != null && typeNode.isTextual() ? typeNode.textValue() : null;
		if(!isKnownType(messageType)) {
			logger.debug("MessageParser: ignoring message with unknown type {}", messageType);
			return null;
		}
		
		return Util.objectMapper().treeToValue(data, types.get(messageType));
	}
	
	public static JsonNode toJson(BaseMessage message) {
		return Util.objectMapper().valueToTree(message);
	}
}
