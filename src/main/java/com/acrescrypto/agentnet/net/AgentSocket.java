package com.acrescrypto.agentnet.net;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.agentnet.config.ConfigFile;

/**
 * A text-framed, bidirectional connection to a network server. One frame carries exactly one envelope.
 * 
 * Reads and writes are independent: a receive loop may sit in {@link #read(long)} while other threads
 * write. Implementations serialize concurrent writes themselves.
 */
public abstract class AgentSocket {
	public interface AgentSocketFactory {
		AgentSocket open(String host, int port, ConfigFile config) throws IOException;
	}
	
	protected final Logger logger = LoggerFactory.getLogger(AgentSocket.class);
	protected String address;
	protected int port = -1;
	
	/** Send one frame. */
	public abstract void write(String frame) throws IOException;
	
	/**
	 * Block for the next frame.
	 * @param timeoutMs maximum time to wait; 0 waits forever
	 * @throws com.acrescrypto.agentnet.exceptions.SocketClosedException if the socket closed, either end
	 * @throws java.net.SocketTimeoutException if no frame arrived in time
	 */
	public abstract String read(long timeoutMs) throws IOException;
	
	protected abstract void _close() throws IOException;
	public abstract boolean isClosed();
	
	public final void close() throws IOException {
		logger.trace("{}:{}: AgentSocket closing", getAddress(), getPort());
		_close();
	}
	
	public void safeClose() {
		try {
			close();
		} catch(IOException exc) {
			logger.warn("{}:{}: AgentSocket caught exception closing socket",
					getAddress(),
					getPort(),
					exc);
		}
	}
	
	public String getAddress() {
		return address;
	}
	
	public int getPort() {
		return port;
	}
}
