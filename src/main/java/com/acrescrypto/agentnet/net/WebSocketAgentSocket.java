package com.acrescrypto.agentnet.net;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.acrescrypto.agentnet.config.ConfigFile;
import com.acrescrypto.agentnet.exceptions.SocketClosedException;

/** {@link AgentSocket} over a plain {@code ws://host:port} WebSocket. */
public class WebSocketAgentSocket extends AgentSocket {
	protected final static Object CLOSED = new Object();
	
	protected WebSocket webSocket;
	protected final LinkedBlockingQueue<Object> frames = new LinkedBlockingQueue<>();
	protected final Object writeLock = new Object();
	protected volatile boolean closed;
	protected long writeTimeoutMs;
	
	public static WebSocketAgentSocket connect(String host, int port, ConfigFile config) throws IOException {
		WebSocketAgentSocket socket = new WebSocketAgentSocket(host, port);
		socket.open(config.getLong("net.connector.connectTimeoutMs"));
		return socket;
	}
	
	protected WebSocketAgentSocket(String host, int port) {
		this.address = host;
		this.port = port;
	}
	
	protected void open(long connectTimeoutMs) throws IOException {
		URI uri = URI.create("ws://" + address + ":" + port);
		this.writeTimeoutMs = connectTimeoutMs;
		HttpClient client = HttpClient.newBuilder()
				.connectTimeout(Duration.ofMillis(connectTimeoutMs))
				.build();
		
		logger.debug("{}:{}: WebSocket connecting to {}", address, port, uri);
		try {
			webSocket = client.newWebSocketBuilder()
					.connectTimeout(Duration.ofMillis(connectTimeoutMs))
					.buildAsync(uri, new FrameListener())
					.get(connectTimeoutMs, TimeUnit.MILLISECONDS);
		} catch(ExecutionException exc) {
			throw new IOException("Unable to connect to " + uri, exc.getCause());
		} catch(TimeoutException exc) {
			throw new SocketTimeoutException("Timed out connecting to " + uri);
		} catch(InterruptedException exc) {
			Thread.currentThread().interrupt();
			throw new IOException("Interrupted connecting to " + uri, exc);
		}
	}
	
	@Override
	public void write(String frame) throws IOException {
		if(closed) throw new SocketClosedException();
		
		// java.net.http allows only one outstanding send per socket
		synchronized(writeLock) {
			try {
				webSocket.sendText(frame, true).get(writeTimeoutMs, TimeUnit.MILLISECONDS);
			} catch(ExecutionException exc) {
				throw new IOException("WebSocket write failed", exc.getCause());
			} catch(TimeoutException exc) {
				throw new SocketTimeoutException("WebSocket write timed out");
			} catch(InterruptedException exc) {
				Thread.currentThread().interrupt();
				throw new IOException("Interrupted writing to WebSocket", exc);
			}
		}
	}
	
	@Override
	public String read(long timeoutMs) throws IOException {
		Object next;
		try {
			next = timeoutMs <= 0
					? frames.take()
					: frames.poll(timeoutMs, TimeUnit.MILLISECONDS);
		} catch(InterruptedException exc) {
			Thread.currentThread().interrupt();
			throw new IOException("Interrupted reading from WebSocket", exc);
		}
		
		if(next == null) throw new SocketTimeoutException("No frame within " + timeoutMs + "ms");
		if(next == CLOSED) {
			frames.offer(CLOSED); // any later reader sees the close too
			throw new SocketClosedException();
		}
		if(next instanceof Throwable) {
			frames.offer(CLOSED);
			throw new IOException("WebSocket failed", (Throwable) next);
		}
		
		return (String) next;
	}
	
	@Override
	protected void _close() throws IOException {
		if(closed) return;
		closed = true;
		frames.offer(CLOSED);
		
		try {
			webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "").get(writeTimeoutMs, TimeUnit.MILLISECONDS);
		} catch(ExecutionException|TimeoutException exc) {
			logger.debug("{}:{}: WebSocket close handshake did not complete", address, port, exc);
		} catch(InterruptedException exc) {
			Thread.currentThread().interrupt();
		} finally {
			webSocket.abort();
		}
	}
	
	@Override
	public boolean isClosed() {
		return closed;
	}
	
	protected class FrameListener implements WebSocket.Listener {
		protected StringBuilder partial = new StringBuilder();
		
		@Override
		public void onOpen(WebSocket webSocket) {
			webSocket.request(1);
		}
		
		@Override
		public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
			partial.append(data);
			if(last) {
				frames.offer(partial.toString());
				partial = new StringBuilder();
			}
			
			webSocket.request(1);
			return CompletableFuture.completedFuture(null);
		}
		
		@Override
		public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
			logger.debug("{}:{}: WebSocket closed by server, status={} reason={}", address, port, statusCode, reason);
			closed = true;
			frames.offer(CLOSED);
			return null;
		}
		
		@Override
		public void onError(WebSocket webSocket, Throwable error) {
			logger.debug("{}:{}: WebSocket error", address, port, error);
			closed = true;
			frames.offer(error);
		}
	}
}
