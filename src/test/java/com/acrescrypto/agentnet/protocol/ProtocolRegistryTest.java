package com.acrescrypto.agentnet.protocol;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.Map;
import java.util.Optional;

import org.junit.Before;
import org.junit.Test;

import com.acrescrypto.agentnet.exceptions.ProtocolRegistrationException;
import com.acrescrypto.agentnet.messages.BaseMessage;
import com.acrescrypto.agentnet.messages.BroadcastMessage;
import com.acrescrypto.agentnet.messages.DirectMessage;
import com.acrescrypto.agentnet.messages.ProtocolMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

public class ProtocolRegistryTest {
	class DummySender implements OutboundSender {
		@Override public String getNetworkId() { return "TestNetwork"; }
		@Override public boolean sendProtocolMessage(ProtocolMessage message) { return true; }
	}

	class DummyProtocol extends AbstractNetworkProtocol {
		LinkedList<BaseMessage> seen = new LinkedList<>();
		boolean initializes = true, acceptsAgents = true, consumes, throwsOnShutdown;
		int shutdowns;

		DummyProtocol(String name) {
			super(name);
		}

		@Override
		public boolean initialize() {
			return initializes;
		}

		@Override
		public boolean shutdown() {
			shutdownOrder.add(name);
			shutdowns++;
			if(throwsOnShutdown) throw new IllegalStateException("shutdown failed");
			return true;
		}

		@Override
		public boolean registerAgent(String agentId, Map<String,Object> metadata) {
			if(!acceptsAgents) return false;
			return super.registerAgent(agentId, metadata);
		}

		@Override
		public DirectMessage processDirectMessage(DirectMessage message) {
			seen.add(message);
			if(consumes) return null;
			message.getContent().put(name, true);
			return message;
		}

		@Override
		public BroadcastMessage processBroadcastMessage(BroadcastMessage message) {
			seen.add(message);
			return consumes ? null : message;
		}

		@Override
		public void processProtocolMessage(ProtocolMessage message) {
			seen.add(message);
		}

		@Override
		public Optional<JsonNode> handleMessage(JsonNode message) {
			return Optional.of(JsonNodeFactory.instance.textNode(name));
		}

		@Override
		public Map<String,Object> getState() {
			HashMap<String,Object> state = new HashMap<>();
			state.put("agents", activeAgents.size());
			return state;
		}
	}

	LinkedList<String> shutdownOrder;
	ProtocolRegistry registry;
	DummyProtocol first, second;

	@Before
	public void beforeEach() throws ProtocolRegistrationException {
		shutdownOrder = new LinkedList<>();
		registry = new ProtocolRegistry(new DummySender());
		first = new DummyProtocol("first");
		second = new DummyProtocol("second");
		registry.registerProtocol(first);
		registry.registerProtocol(second);
	}

	@Test
	public void testRegisteredProtocolsAreListedInOrder() {
		assertEquals(Arrays.asList("first", "second"), registry.listProtocols());
		assertSame(first, registry.getProtocol("first"));
		assertNull(registry.getProtocol("third"));
		assertEquals("TestNetwork", first.getNetwork().getNetworkId());
	}

	@Test
	public void testDuplicateNameIsRejected() {
		try {
			registry.registerProtocol(new DummyProtocol("first"));
			fail();
		} catch(ProtocolRegistrationException exc) {
			assertEquals("first", exc.getProtocolName());
		}
	}

	@Test(expected=ProtocolRegistrationException.class)
	public void testProtocolAlreadyBoundElsewhereIsRejected() throws ProtocolRegistrationException {
		DummyProtocol third = new DummyProtocol("third");
		third.registerWithNetwork(new DummySender());
		registry.registerProtocol(third);
	}

	@Test
	public void testFailedInitializeIsRejected() {
		DummyProtocol third = new DummyProtocol("third");
		third.initializes = false;
		try {
			registry.registerProtocol(third);
			fail();
		} catch(ProtocolRegistrationException exc) {
			assertFalse(registry.listProtocols().contains("third"));
		}
	}

	@Test
	public void testDirectMessagesPassThroughEveryProtocolInOrder() {
		DirectMessage message = new DirectMessage("A1", "A2", new HashMap<>());
		BaseMessage routed = registry.routeMessage(message);

		assertSame(message, routed);
		assertEquals(true, routed.getContent().get("first"));
		assertEquals(true, routed.getContent().get("second"));
		assertEquals(1, first.seen.size());
		assertEquals(1, second.seen.size());
	}

	@Test
	public void testConsumedMessageStopsThePipeline() {
		first.consumes = true;
		assertNull(registry.routeMessage(new BroadcastMessage("A1", new HashMap<>())));
		assertEquals(1, first.seen.size());
		assertTrue(second.seen.isEmpty());
	}

	@Test
	public void testProtocolMessagesReachOnlyTheNamedProtocol() {
		assertNull(registry.routeMessage(new ProtocolMessage("A1", "second", new HashMap<>())));
		assertTrue(first.seen.isEmpty());
		assertEquals(1, second.seen.size());

		assertNull(registry.routeMessage(new ProtocolMessage("A1", "missing", new HashMap<>())));
		assertEquals(1, second.seen.size());
	}

	@Test
	public void testHandleMessageGoesToNamedProtocol() {
		JsonNode raw = JsonNodeFactory.instance.objectNode();
		assertEquals("second", registry.handleMessage("second", raw).get().textValue());
		assertFalse(registry.handleMessage("missing", raw).isPresent());
	}

	@Test
	public void testAgentMembershipFansOut() {
		assertTrue(registry.registerAgent("A1", null));
		assertTrue(first.getActiveAgents().contains("A1"));
		assertTrue(second.getActiveAgents().contains("A1"));

		assertTrue(registry.unregisterAgent("A1"));
		assertTrue(first.getActiveAgents().isEmpty());
		assertTrue(registry.unregisterAgent("nobody"));
	}

	@Test
	public void testRefusedAgentIsReported() {
		second.acceptsAgents = false;
		assertFalse(registry.registerAgent("A1", null));
		assertTrue(first.getActiveAgents().contains("A1"));
	}

	@Test
	public void testStateIsKeyedByProtocolName() {
		registry.registerAgent("A1", null);
		Map<String,Map<String,Object>> state = registry.getState();
		assertEquals(Arrays.asList("first", "second"), Arrays.asList(state.keySet().toArray()));
		assertEquals(1, state.get("first").get("agents"));
	}

	@Test
	public void testShutdownRunsInReverseAndClears() {
		first.throwsOnShutdown = true;
		assertFalse(registry.shutdown());
		assertEquals(Arrays.asList("second", "first"), shutdownOrder);
		assertTrue(registry.listProtocols().isEmpty());

		assertTrue(registry.shutdown());
		assertEquals(1, first.shutdowns);
	}
}
