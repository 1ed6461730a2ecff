package com.acrescrypto.agentnet.exceptions;

/** Thrown when a peer sends something that cannot be an envelope at all. */
public class ProtocolViolationException extends Exception {
	public ProtocolViolationException() {
		super();
	}
	
	public ProtocolViolationException(String message) {
		super(message);
	}
	
	public ProtocolViolationException(String message, Throwable cause) {
		super(message, cause);
	}

	private static final long serialVersionUID = -5308442893750412227L;
}
