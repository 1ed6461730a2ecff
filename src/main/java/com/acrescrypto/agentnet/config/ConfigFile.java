package com.acrescrypto.agentnet.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.agentnet.exceptions.ENOENTException;
import com.acrescrypto.agentnet.utility.Util;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/* Flat key/value settings for connectors and protocols. Explicitly set values win over defaults; a
 * config may be backed by a JSON file, in which case every set() is written through.
 */
public class ConfigFile {
	protected ConcurrentHashMap<String,JsonNode> info = new ConcurrentHashMap<>();
	protected HashMap<String,Object> defaults = new HashMap<>();
	protected Path path;
	
	protected Logger logger = LoggerFactory.getLogger(ConfigFile.class);
	protected boolean autowriteEnabled = true;
	
	public ConfigFile() {
	}
	
	public ConfigFile(Path path) throws IOException {
		this.path = path;
		
		try {
			read();
			logger.info("Config: Loaded existing file {}", path);
		} catch(ENOENTException exc) {
			logger.info("Config: No pre-existing config file at {}", path);
		}
	}
	
	protected void deserialize(byte[] serialized) throws IOException {
		info.clear();
		JsonNode json = Util.objectMapper().readTree(serialized);
		if(json == null || !json.isObject()) {
			throw new IOException(path + ": config must be a JSON object");
		}
		
		boolean oldAutowriteEnabled = autowriteEnabled;
		this.autowriteEnabled = false; // don't rewrite config when calling set()
		
		Iterator<Map.Entry<String,JsonNode>> it = json.fields();
		while(it.hasNext()) {
			Map.Entry<String,JsonNode> entry = it.next();
			this.set(entry.getKey(), entry.getValue());
		}
		
		this.autowriteEnabled = oldAutowriteEnabled;
	}
	
	protected byte[] serialize() throws IOException {
		ObjectNode node = JsonNodeFactory.instance.objectNode();
		for(String key : info.keySet()) {
			node.set(key, info.get(key));
		}
		
		return Util.objectMapper().writerWithDefaultPrettyPrinter().writeValueAsBytes(node);
	}
	
	protected void read() throws IOException {
		try {
			deserialize(Files.readAllBytes(path));
		} catch(NoSuchFileException exc) {
			throw new ENOENTException(path.toString());
		}
	}
	
	protected void write() throws IOException {
		Files.write(path, serialize());
	}
	
	protected synchronized void writeQuietly() {
		if(path == null || !autowriteEnabled) return;
		try {
			write();
		} catch(IOException exc) {
			logger.error("Config: Caught exception writing {}", path, exc);
		}
	}
	
	public synchronized void set(String key, JsonNode value) {
		logger.debug("Config: Setting {} -> {}", key, value);
		info.put(key, value);
		writeQuietly();
	}
	
	public void set(String key, boolean value) {
		set(key, JsonNodeFactory.instance.booleanNode(value));
	}
	
	public void set(String key, int value) {
		set(key, JsonNodeFactory.instance.numberNode(value));
	}
	
	public void set(String key, long value) {
		set(key, JsonNodeFactory.instance.numberNode(value));
	}
	
	public void set(String key, String value) {
		set(key, JsonNodeFactory.instance.textNode(value));
	}
	
	public void setDefault(String key, Object value) {
		defaults.put(key, value);
	}
	
	public boolean hasKey(String key) {
		return info.containsKey(key);
	}
	
	public boolean hasDefault(String key) {
		return defaults.containsKey(key);
	}
	
	public boolean getBool(String key) {
		if(!hasKey(key)) return (boolean) requireDefault(key);
		return info.get(key).asBoolean();
	}
	
	public int getInt(String key) {
		if(!hasKey(key)) return ((Number) requireDefault(key)).intValue();
		return info.get(key).asInt();
	}
	
	public long getLong(String key) {
		if(!hasKey(key)) return ((Number) requireDefault(key)).longValue();
		return info.get(key).asLong();
	}
	
	public String getString(String key) {
		if(!hasKey(key)) return (String) requireDefault(key);
		return info.get(key).asText();
	}
	
	/** Copy every default registered on another config that this one does not already define. */
	public ConfigFile inheritDefaults(ConfigFile other) {
		for(Map.Entry<String,Object> entry : other.defaults.entrySet()) {
			defaults.putIfAbsent(entry.getKey(), entry.getValue());
		}
		
		return this;
	}
	
	protected Object requireDefault(String key) {
		if(!defaults.containsKey(key)) {
			throw new IllegalArgumentException("No value or default for config key " + key);
		}
		
		return defaults.get(key);
	}
}
