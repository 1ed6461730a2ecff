package com.acrescrypto.agentnet.protocol.messaging;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;

import org.junit.After;
import org.junit.Test;

import com.acrescrypto.agentnet.messages.BaseMessage;
import com.acrescrypto.agentnet.messages.DirectMessage;
import com.acrescrypto.agentnet.utility.Util;

public class MessageHistoryTest {
	static DirectMessage messageAt(long timestamp) {
		DirectMessage message = new DirectMessage("A1", "A2", new HashMap<>());
		message.setTimestamp(timestamp);
		return message;
	}

	@After
	public void afterEach() {
		Util.setCurrentTimeNanos(-1);
	}

	@Test
	public void testAddAndLookup() {
		MessageHistory history = new MessageHistory(10, 2);
		DirectMessage message = messageAt(1);
		history.add(message);

		assertTrue(history.contains(message.getMessageId()));
		assertSame(message, history.get(message.getMessageId()));
		assertNull(history.get("nope"));
		assertEquals(1, history.size());
	}

	@Test
	public void testReaddingSameIdDoesNotGrow() {
		MessageHistory history = new MessageHistory(10, 2);
		DirectMessage message = messageAt(1);
		history.add(message);
		history.add(message);
		assertEquals(1, history.size());
	}

	@Test
	public void testOverflowEvictsOldestBatchByTimestamp() {
		MessageHistory history = new MessageHistory(5, 2);
		LinkedList<DirectMessage> added = new LinkedList<>();

		// insertion order deliberately differs from timestamp order
		long[] timestamps = { 50, 10, 40, 20, 30 };
		for(long ts : timestamps) {
			DirectMessage message = messageAt(ts);
			added.add(message);
			history.add(message);
		}
		assertEquals(5, history.size());

		DirectMessage newest = messageAt(60);
		history.add(newest);

		assertEquals(4, history.size());
		assertFalse(history.contains(added.get(1).getMessageId())); // ts 10
		assertFalse(history.contains(added.get(3).getMessageId())); // ts 20
		assertTrue(history.contains(added.get(4).getMessageId()));
		assertTrue(history.contains(newest.getMessageId()));
	}

	@Test
	public void testSizeNeverExceedsMaximum() {
		MessageHistory history = new MessageHistory(1000, 100);
		for(int i = 0; i < 1000; i++) {
			history.add(messageAt(i));
		}
		assertEquals(1000, history.size());

		history.add(messageAt(1000));
		assertEquals(901, history.size());

		for(int i = 0; i < 3000; i++) {
			history.add(messageAt(1001 + i));
			assertTrue(history.size() <= 1000);
			assertTrue(history.size() >= 901);
		}
	}

	@Test
	public void testTrimBatchIsClampedToMaximum() {
		MessageHistory history = new MessageHistory(3, 50);
		assertEquals(3, history.getMaxSize());
		assertEquals(3, history.getTrimBatchSize());

		for(int i = 0; i < 4; i++) {
			history.add(messageAt(i));
		}
		assertEquals(1, history.size());
	}

	@Test(expected=IllegalArgumentException.class)
	public void testRejectsNonPositiveMaximum() {
		new MessageHistory(0, 1);
	}

	@Test(expected=IllegalArgumentException.class)
	public void testRejectsNonPositiveTrimBatch() {
		new MessageHistory(10, 0);
	}

	@Test
	public void testSnapshotIsACopy() {
		MessageHistory history = new MessageHistory(10, 2);
		history.add(messageAt(1));
		List<BaseMessage> snapshot = history.snapshot();
		history.clear();

		assertEquals(1, snapshot.size());
		assertEquals(0, history.size());
	}

	@Test
	public void testConcurrentAddsStayBounded() throws Exception {
		MessageHistory history = new MessageHistory(200, 20);
		Thread[] threads = new Thread[4];
		for(int t = 0; t < threads.length; t++) {
			threads[t] = new Thread(()->{
				for(int i = 0; i < 1000; i++) {
					history.add(messageAt(i));
				}
			});
			threads[t].start();
		}

		for(Thread thread : threads) {
			thread.join();
		}

		assertTrue(history.size() <= 200);
		assertTrue(history.size() > 180);
	}
}
