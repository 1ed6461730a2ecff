package com.acrescrypto.agentnet.protocol.messaging;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.agentnet.messages.BaseMessage;

/**
 * Recently processed messages keyed by message id. Once an insert pushes the size past the maximum, the
 * oldest entries by timestamp are evicted in one batch, so the size drops to between
 * {@code maxSize - trimBatchSize + 1} and {@code maxSize}.
 */
public class MessageHistory {
	private final Logger logger = LoggerFactory.getLogger(MessageHistory.class);
	
	protected final LinkedHashMap<String,BaseMessage> messages = new LinkedHashMap<>();
	protected final int maxSize;
	protected final int trimBatchSize;
	
	public MessageHistory(int maxSize, int trimBatchSize) {
		Validate.isTrue(maxSize > 0, "maxSize must be positive: %d", maxSize);
		Validate.isTrue(trimBatchSize > 0, "trimBatchSize must be positive: %d", trimBatchSize);
		
		this.maxSize = maxSize;
		this.trimBatchSize = Math.min(trimBatchSize, maxSize);
	}
	
	public synchronized void add(BaseMessage message) {
		messages.put(message.getMessageId(), message);
		while(messages.size() > maxSize) {
			trim();
		}
	}
	
	protected void trim() {
		ArrayList<BaseMessage> byAge = new ArrayList<>(messages.values());
		byAge.sort(Comparator.comparingLong(BaseMessage::getTimestamp));
		
		int evicting = Math.min(trimBatchSize, byAge.size());
		for(int i = 0; i < evicting; i++) {
			messages.remove(byAge.get(i).getMessageId());
		}
		
		logger.debug("MessageHistory: Evicted {} oldest messages, {} remain", evicting, messages.size());
	}
	
	public synchronized BaseMessage get(String messageId) {
		return messages.get(messageId);
	}
	
	public synchronized boolean contains(String messageId) {
		return messages.containsKey(messageId);
	}
	
	public synchronized int size() {
		return messages.size();
	}
	
	public synchronized void clear() {
		messages.clear();
	}
	
	/** Copy of the current contents in insertion order. */
	public synchronized List<BaseMessage> snapshot() {
		return new ArrayList<>(messages.values());
	}
	
	public int getMaxSize() {
		return maxSize;
	}
	
	public int getTrimBatchSize() {
		return trimBatchSize;
	}
}
