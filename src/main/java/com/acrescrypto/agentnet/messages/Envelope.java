package com.acrescrypto.agentnet.messages;

import java.io.IOException;
import java.util.Map;

import com.acrescrypto.agentnet.exceptions.ProtocolViolationException;
import com.acrescrypto.agentnet.utility.Util;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One wire transmission. The {@code type} field says how to read the rest:
 * <ul>
 * <li>{@code message}: application message under {@code data}</li>
 * <li>{@code system_request}: {@code command} plus flat parameters</li>
 * <li>{@code system_response}: {@code command}, {@code success} plus flat extras</li>
 * </ul>
 */
public class Envelope {
	public final static String TYPE_MESSAGE         = "message";
	public final static String TYPE_SYSTEM_REQUEST  = "system_request";
	public final static String TYPE_SYSTEM_RESPONSE = "system_response";
	
	protected ObjectNode json;
	
	public static Envelope parse(String text) throws ProtocolViolationException {
		JsonNode node;
		try {
			node = Util.objectMapper().readTree(text);
		} catch(IOException exc) {
			throw new ProtocolViolationException("envelope is not valid JSON", exc);
		}
		
		if(node == null || !node.isObject()) {
			throw new ProtocolViolationException("envelope is not a JSON object");
		}
		
		if(!node.has("type") || !node.get("type").isTextual()) {
			throw new ProtocolViolationException("envelope has no type");
		}
		
		return new Envelope((ObjectNode) node);
	}
	
	public static Envelope message(BaseMessage message) {
		ObjectNode node = JsonNodeFactory.instance.objectNode();
		node.put("type", TYPE_MESSAGE);
		node.set("data", MessageParser.toJson(message));
		return new Envelope(node);
	}
	
	public static Envelope systemRequest(String command, Map<String,?> params) {
		ObjectNode node = JsonNodeFactory.instance.objectNode();
		node.put("type", TYPE_SYSTEM_REQUEST);
		node.put("command", command);
		putAll(node, params);
		return new Envelope(node);
	}
	
	public static Envelope systemResponse(String command, boolean success, Map<String,?> extras) {
		ObjectNode node = JsonNodeFactory.instance.objectNode();
		node.put("type", TYPE_SYSTEM_RESPONSE);
		node.put("command", command);
		node.put("success", success);
		putAll(node, extras);
		return new Envelope(node);
	}
	
	protected static void putAll(ObjectNode node, Map<String,?> fields) {
		if(fields == null) return;
		for(Map.Entry<String,?> entry : fields.entrySet()) {
			node.set(entry.getKey(), Util.objectMapper().valueToTree(entry.getValue()));
		}
	}
	
	public Envelope(ObjectNode json) {
		this.json = json;
	}
	
	public String getType() {
		return json.path("type").asText(null);
	}
	
	public boolean isMessage() {
		return TYPE_MESSAGE.equals(getType());
	}
	
	public boolean isSystemRequest() {
		return TYPE_SYSTEM_REQUEST.equals(getType());
	}
	
	public boolean isSystemResponse() {
		return TYPE_SYSTEM_RESPONSE.equals(getType());
	}
	
	public String getCommand() {
		JsonNode command = json.get("command");
		return command != null && command.isTextual() ? command.textValue() : null;
	}
	
	/** Missing or non-boolean {@code success} counts as failure. */
	public boolean isSuccess() {
		JsonNode success = json.get("success");
		return success != null && success.isBoolean() && success.booleanValue();
	}
	
	public JsonNode getData() {
		return json.get("data");
	}
	
	public JsonNode get(String field) {
		return json.get(field);
	}
	
	public String getText(String field) {
		JsonNode value = json.get(field);
		return value != null && value.isTextual() ? value.textValue() : null;
	}
	
	public ObjectNode getJson() {
		return json;
	}
	
	public String toJson() throws JsonProcessingException {
		return Util.objectMapper().writeValueAsString(json);
	}
	
	@Override
	public String toString() {
		return json.toString();
	}
}
