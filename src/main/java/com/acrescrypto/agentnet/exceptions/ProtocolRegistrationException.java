package com.acrescrypto.agentnet.exceptions;

public class ProtocolRegistrationException extends Exception {
	protected String protocolName;
	
	public ProtocolRegistrationException(String protocolName, String reason) {
		super(protocolName + ": " + reason);
		this.protocolName = protocolName;
	}
	
	public String getProtocolName() {
		return protocolName;
	}

	private static final long serialVersionUID = 6614130285410943319L;
}
