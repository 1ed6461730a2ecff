package com.acrescrypto.agentnet.utility;

import java.util.Base64;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

public class Util {
	static long debugTime = -1;
	protected static ObjectMapper objectMapper;
	
	public interface WaitTest {
		boolean test();
	}
	
	/** Shared mapper for everything that goes over the wire. Field names are snake_case on the wire. */
	public static synchronized ObjectMapper objectMapper() {
		if(objectMapper == null) {
			ObjectMapper mapper = new ObjectMapper();
			mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
			mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
			mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
			objectMapper = mapper;
		}
		
		return objectMapper;
	}
	
	public static boolean waitUntil(int maxDelay, WaitTest test) {
		long endTime = maxDelay <= 0 ? Long.MAX_VALUE : System.currentTimeMillis() + maxDelay;
		while(System.currentTimeMillis() < endTime && !test.test()) {
			try {
				Thread.sleep(1);
			} catch(InterruptedException exc) {}
		}
		
		return System.currentTimeMillis() < endTime;
	}
	
	public static long currentTimeNanos() {
		if(debugTime < 0) return 1000l*1000l*System.currentTimeMillis();
		return debugTime;
	}
	
	public static long currentTimeMillis() {
		return currentTimeNanos()/(1000l*1000l);
	}
	
	public static void setCurrentTimeNanos(long time) {
		debugTime = time;
	}

	public static void setCurrentTimeMillis(long time) {
		setCurrentTimeNanos(time*1000l*1000l);		
	}
	
	public static void setThreadName(String name) {
		Thread.currentThread().setName(name + " " + String.format("%08x", System.identityHashCode(Thread.currentThread())));
	}
	
	/** Lenient decode; characters outside the base64 alphabet (line breaks, padding noise) are skipped. */
	public static byte[] decode64(String base64) {
		return Base64.getMimeDecoder().decode(base64);
	}
	
	public static String encode64(byte[] data) {
		return Base64.getEncoder().encodeToString(data);
	}
	
	public static String formatAgentId(String agentId) {
		return agentId == null ? "agent-?" : "agent-" + agentId;
	}
}
