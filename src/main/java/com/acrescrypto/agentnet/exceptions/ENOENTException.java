package com.acrescrypto.agentnet.exceptions;

import java.io.IOException;

/** A stored file or config file that does not exist, named by its id or path. */
public class ENOENTException extends IOException {
	public ENOENTException(String name) {
		super(name + ": no such file or directory");
	}

	private static final long serialVersionUID = 4190253870741226683L;
}
