package com.acrescrypto.agentnet.protocol.messaging;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/** A stored attachment. The bytes behind it never change once written. */
public class FileRecord {
	protected final String fileId;
	protected final String filename;
	protected final int size;
	protected final String mimeType;
	protected final Path path;
	
	public FileRecord(String fileId, String filename, int size, String mimeType, Path path) {
		this.fileId = fileId;
		this.filename = filename;
		this.size = size;
		this.mimeType = mimeType;
		this.path = path;
	}
	
	/** The reference left in a message in place of the inline content. */
	public Map<String,Object> toAttachmentEntry() {
		LinkedHashMap<String,Object> entry = new LinkedHashMap<>();
		entry.put("file_id", fileId);
		entry.put("filename", filename);
		entry.put("size", size);
		entry.put("mime_type", mimeType);
		return entry;
	}

	public String getFileId() {
		return fileId;
	}

	public String getFilename() {
		return filename;
	}

	public int getSize() {
		return size;
	}

	public String getMimeType() {
		return mimeType;
	}

	public Path getPath() {
		return path;
	}
}
