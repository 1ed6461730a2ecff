package com.acrescrypto.agentnet.exceptions;

import java.io.IOException;

public class SocketClosedException extends IOException {
	public SocketClosedException() {
		super("socket closed");
	}
	
	public SocketClosedException(String reason) {
		super("socket closed: " + reason);
	}

	private static final long serialVersionUID = 2374881634157238461L;
}
