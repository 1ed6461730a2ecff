package com.acrescrypto.agentnet.net;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.agentnet.config.ConfigDefaults;
import com.acrescrypto.agentnet.config.ConfigFile;
import com.acrescrypto.agentnet.exceptions.ProtocolViolationException;
import com.acrescrypto.agentnet.exceptions.SocketClosedException;
import com.acrescrypto.agentnet.messages.BaseMessage;
import com.acrescrypto.agentnet.messages.BroadcastMessage;
import com.acrescrypto.agentnet.messages.DirectMessage;
import com.acrescrypto.agentnet.messages.Envelope;
import com.acrescrypto.agentnet.messages.MessageParser;
import com.acrescrypto.agentnet.messages.ProtocolMessage;
import com.acrescrypto.agentnet.messages.ProtocolMessage.Direction;
import com.acrescrypto.agentnet.net.AgentSocket.AgentSocketFactory;
import com.acrescrypto.agentnet.utility.GroupedThreadPool;
import com.acrescrypto.agentnet.utility.Util;

/**
 * Agent-side end of a network connection. Registers the agent with the server, then runs a single
 * receive loop that hands each inbound envelope to the handler registered for its message type or
 * system command.
 *
 * Handlers run on the receive thread, one at a time, in arrival order. A handler that blocks holds up
 * every later envelope on this connection.
 */
public class NetworkConnector {
	public interface MessageHandler {
		void handle(BaseMessage message) throws Exception;
	}

	public interface SystemResponseHandler {
		void handle(Envelope response) throws Exception;
	}

	protected final Logger logger = LoggerFactory.getLogger(NetworkConnector.class);

	protected final MessageHandler unhandledMessage = (message)->{
		logger.trace("{}: No handler for message type {}, dropping {}",
				Util.formatAgentId(this.agentId),
				message.getMessageType(),
				message.getMessageId());
	};

	protected final SystemResponseHandler unhandledSystemResponse = (response)->{
		logger.debug("{}: Received system response for command {}",
				Util.formatAgentId(this.agentId),
				response.getCommand());
	};

	protected String host;
	protected int port;
	protected String agentId;
	protected Map<String,Object> metadata;
	protected ConfigFile config;
	protected AgentSocketFactory socketFactory;

	protected volatile AgentSocket socket;
	protected volatile boolean connected;
	protected String networkName;
	protected ConcurrentHashMap<String,MessageHandler> messageHandlers = new ConcurrentHashMap<>();
	protected ConcurrentHashMap<String,SystemResponseHandler> systemHandlers = new ConcurrentHashMap<>();
	protected GroupedThreadPool threadPool;
	protected volatile CompletableFuture<Void> receiveLoopCompletion = CompletableFuture.completedFuture(null);
	protected volatile Thread receiveThread;

	public NetworkConnector(String host, int port, String agentId, Map<String,Object> metadata) {
		this(host, port, agentId, metadata, ConfigDefaults.getActiveDefaults(), WebSocketAgentSocket::connect);
	}

	public NetworkConnector(String host, int port, String agentId, Map<String,Object> metadata, ConfigFile config, AgentSocketFactory socketFactory) {
		this.host = host;
		this.port = port;
		this.agentId = agentId;
		this.metadata = metadata;
		this.config = config;
		this.socketFactory = socketFactory;
		this.threadPool = GroupedThreadPool.newCachedThreadPool("NetworkConnector " + agentId);
	}

	/**
	 * Open the transport and register this agent. Blocks for the server's registration response, which
	 * is the only reply this class ever waits for. No retries; the caller picks its own policy.
	 *
	 * @return true if the server accepted the registration and the receive loop is running
	 */
	public synchronized boolean connect() {
		if(connected) {
			logger.warn("{}: Already connected to {}:{}; disconnect first", Util.formatAgentId(agentId), host, port);
			return false;
		}

		releaseStaleSocket();

		AgentSocket newSocket = null;
		try {
			newSocket = socketFactory.open(host, port, config);

			HashMap<String,Object> params = new HashMap<>();
			params.put("agent_id", agentId);
			params.put("metadata", metadata);
			SystemCommands.sendSystemRequest(newSocket, SystemCommands.REGISTER_AGENT, params);

			Envelope response = Envelope.parse(newSocket.read(config.getLong("net.connector.handshakeTimeoutMs")));
			if(response.isSystemResponse()
					&& SystemCommands.REGISTER_AGENT.equals(response.getCommand())
					&& response.isSuccess())
			{
				// completion and socket are published before connected, which senders read first
				CompletableFuture<Void> completion = new CompletableFuture<>();
				receiveLoopCompletion = completion;
				socket = newSocket;
				networkName = response.getText("network_name");
				connected = true;
				logger.info("{}: Connected to network {}", Util.formatAgentId(agentId), networkName);
				startReceiveLoop(newSocket, completion);
				return true;
			}

			logger.warn("{}: Registration with {}:{} rejected: {}", Util.formatAgentId(agentId), host, port, response);
		} catch(IOException|ProtocolViolationException exc) {
			logger.error("{}: Connection error to {}:{}", Util.formatAgentId(agentId), host, port, exc);
		}

		if(newSocket != null) newSocket.safeClose();
		return false;
	}

	/**
	 * Close the transport. The receive loop observes the close and exits; we wait a bounded time for it
	 * but never interrupt a handler that is still running.
	 *
	 * @return false if there was no connection to close
	 */
	public boolean disconnect() {
		AgentSocket closing;
		synchronized(this) {
			if(socket == null) return false;
			closing = socket;
			socket = null;
			connected = false;
		}

		try {
			closing.close();
		} catch(IOException exc) {
			logger.error("{}: Error disconnecting", Util.formatAgentId(agentId), exc);
			return false;
		}

		if(Thread.currentThread() != receiveThread) {
			awaitReceiveLoop(config.getLong("net.connector.disconnectJoinTimeoutMs"));
		}

		logger.info("{}: Disconnected from network", Util.formatAgentId(agentId));
		return true;
	}

	/** Stop the connector for good; no further connect() is possible. */
	public void close() {
		disconnect();
		threadPool.shutdown();
	}

	public void registerMessageHandler(String messageType, MessageHandler handler) {
		messageHandlers.put(messageType, handler);
		logger.debug("{}: Registered handler for message type {}", Util.formatAgentId(agentId), messageType);
	}

	public void registerSystemHandler(String command, SystemResponseHandler handler) {
		systemHandlers.put(command, handler);
		logger.debug("{}: Registered handler for system command {}", Util.formatAgentId(agentId), command);
	}

	protected MessageHandler messageHandlerFor(String messageType) {
		if(messageType == null) return unhandledMessage;
		return messageHandlers.getOrDefault(messageType, unhandledMessage);
	}

	protected SystemResponseHandler systemHandlerFor(String command) {
		if(command == null) return unhandledSystemResponse;
		return systemHandlers.getOrDefault(command, unhandledSystemResponse);
	}

	protected void startReceiveLoop(AgentSocket loopSocket, CompletableFuture<Void> completion) {
		threadPool.submit(()->{
			receiveThread = Thread.currentThread();
			try {
				receiveLoop(loopSocket);
			} finally {
				receiveThread = null;
				completion.complete(null);
			}
		});
	}

	protected void receiveLoop(AgentSocket loopSocket) {
		try {
			while(connected) {
				String frame = loopSocket.read(0);
				dispatch(Envelope.parse(frame));
			}
		} catch(SocketClosedException exc) {
			markLoopEnded(loopSocket);
			logger.info("{}: Disconnected from server", Util.formatAgentId(agentId));
		} catch(Exception exc) {
			markLoopEnded(loopSocket);
			logger.error("{}: Error in message listener", Util.formatAgentId(agentId), exc);
		}
	}

	protected synchronized void markLoopEnded(AgentSocket loopSocket) {
		// a reconnect may already have replaced the socket this loop was reading
		if(socket == loopSocket) connected = false;
	}

	protected void dispatch(Envelope envelope) throws Exception {
		if(envelope.isMessage()) {
			BaseMessage message = MessageParser.parse(envelope.getData());
			if(message == null) return;

			logger.debug("{}: Received message from {} with id {}",
					Util.formatAgentId(agentId),
					message.getSenderId(),
					message.getMessageId());
			consumeMessage(message);
		} else if(envelope.isSystemResponse()) {
			systemHandlerFor(envelope.getCommand()).handle(envelope);
		} else {
			logger.debug("{}: Ignoring envelope of type {}", Util.formatAgentId(agentId), envelope.getType());
		}
	}

	/** Deliver a message to this agent's handler for its type. Unhandled types are dropped. */
	public void consumeMessage(BaseMessage message) throws Exception {
		if(message instanceof ProtocolMessage) {
			((ProtocolMessage) message).markHop(Direction.INBOUND, agentId);
		}

		messageHandlerFor(message.getMessageType()).handle(message);
	}

	/**
	 * Serialize and write a message. Fills in the sender if it is missing.
	 *
	 * @return false if we aren't connected or the write failed; never throws
	 */
	public boolean sendMessage(BaseMessage message) {
		if(!connected) {
			logger.warn("{}: Not connected to a network", Util.formatAgentId(agentId));
			return false;
		}
		
		AgentSocket sendSocket = socket;
		if(sendSocket == null) {
			logger.warn("{}: Connection closed during send", Util.formatAgentId(agentId));
			return false;
		}

		try {
			if(message.getSenderId() == null || message.getSenderId().isEmpty()) {
				message.setSenderId(agentId);
			}

			if(message instanceof ProtocolMessage) {
				((ProtocolMessage) message).markHop(Direction.OUTBOUND, agentId);
			}

			sendSocket.write(Envelope.message(message).toJson());
			logger.debug("{}: Message sent: {}", Util.formatAgentId(agentId), message.getMessageId());
			return true;
		} catch(IOException|RuntimeException exc) {
			logger.error("{}: Failed to send message {}", Util.formatAgentId(agentId), message.getMessageId(), exc);
			return false;
		}
	}

	public boolean sendDirectMessage(DirectMessage message) {
		return sendMessage(message);
	}

	public boolean sendBroadcastMessage(BroadcastMessage message) {
		return sendMessage(message);
	}

	public boolean sendProtocolMessage(ProtocolMessage message) {
		return sendMessage(message);
	}

	/**
	 * Fire-and-forget control request. The response, if any, arrives later through whatever
	 * {@link SystemResponseHandler} is registered for the command.
	 */
	public boolean sendSystemRequest(String command, Map<String,?> params) {
		if(!connected) {
			logger.warn("{}: Not connected to a network", Util.formatAgentId(agentId));
			return false;
		}
		
		AgentSocket sendSocket = socket;
		if(sendSocket == null) {
			logger.warn("{}: Connection closed during send", Util.formatAgentId(agentId));
			return false;
		}

		try {
			SystemCommands.sendSystemRequest(sendSocket, command, params);
			return true;
		} catch(IOException exc) {
			logger.error("{}: Failed to send system request {}", Util.formatAgentId(agentId), command, exc);
			return false;
		}
	}

	public boolean sendSystemRequest(String command) {
		return sendSystemRequest(command, null);
	}

	public boolean listAgents() {
		return sendSystemRequest(SystemCommands.LIST_AGENTS);
	}

	public boolean listProtocols() {
		return sendSystemRequest(SystemCommands.LIST_PROTOCOLS);
	}

	public boolean getProtocolManifest(String protocolName) {
		HashMap<String,Object> params = new HashMap<>();
		params.put("protocol_name", protocolName);
		return sendSystemRequest(SystemCommands.GET_PROTOCOL_MANIFEST, params);
	}

	/** Completes when the current receive loop exits, for whatever reason. */
	public CompletableFuture<Void> getReceiveLoopCompletion() {
		return receiveLoopCompletion;
	}

	public boolean awaitReceiveLoop(long timeoutMs) {
		try {
			receiveLoopCompletion.get(timeoutMs, TimeUnit.MILLISECONDS);
			return true;
		} catch(TimeoutException exc) {
			logger.warn("{}: Receive loop still busy after {}ms", Util.formatAgentId(agentId), timeoutMs);
			return false;
		} catch(ExecutionException exc) {
			logger.error("{}: Receive loop failed", Util.formatAgentId(agentId), exc);
			return true;
		} catch(InterruptedException exc) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	/** A loop that died on an error leaves its socket behind until the next connect() or disconnect(). */
	protected void releaseStaleSocket() {
		if(socket == null) return;
		logger.debug("{}: Releasing socket left by a terminated receive loop", Util.formatAgentId(agentId));
		socket.safeClose();
		socket = null;
	}

	public boolean isConnected() {
		return connected;
	}

	public String getAgentId() {
		return agentId;
	}

	public String getNetworkName() {
		return networkName;
	}

	public String getHost() {
		return host;
	}

	public int getPort() {
		return port;
	}

	public Map<String,Object> getMetadata() {
		return metadata;
	}
}
