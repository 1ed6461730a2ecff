package com.acrescrypto.agentnet.config;

public class ConfigDefaults {
	protected static ConfigFile activeDefaults;
	
	public static synchronized ConfigFile getActiveDefaults() {
		if(activeDefaults == null) {
			resetDefaults();
		}
		
		return activeDefaults;
	}
	
	public static synchronized void resetDefaults() {
		activeDefaults = initBaseDefaults();
	}
	
	public static ConfigFile initBaseDefaults() {
		ConfigFile config = new ConfigFile();
		
		config.setDefault("net.connector.handshakeTimeoutMs",          30000);
		config.setDefault("net.connector.connectTimeoutMs",            10000);
		config.setDefault("net.connector.disconnectJoinTimeoutMs",      5000);
		
		config.setDefault("protocol.messaging.maxHistorySize",          1000);
		config.setDefault("protocol.messaging.historyTrimBatchSize",     100);
		config.setDefault("protocol.messaging.storagePrefix", "agentnet_files_");
		
		return config;
	}
}
