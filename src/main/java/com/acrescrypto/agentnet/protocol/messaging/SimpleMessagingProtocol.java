package com.acrescrypto.agentnet.protocol.messaging;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.acrescrypto.agentnet.config.ConfigDefaults;
import com.acrescrypto.agentnet.config.ConfigFile;
import com.acrescrypto.agentnet.exceptions.ENOENTException;
import com.acrescrypto.agentnet.messages.BaseMessage;
import com.acrescrypto.agentnet.messages.BroadcastMessage;
import com.acrescrypto.agentnet.messages.DirectMessage;
import com.acrescrypto.agentnet.messages.MessageParser;
import com.acrescrypto.agentnet.messages.ProtocolMessage;
import com.acrescrypto.agentnet.messages.ProtocolMessage.Direction;
import com.acrescrypto.agentnet.protocol.AbstractNetworkProtocol;
import com.acrescrypto.agentnet.protocol.OutboundSender;
import com.acrescrypto.agentnet.utility.Util;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Direct and broadcast messaging with file attachments.
 *
 * Messages passing through are recorded in a bounded history. Inline base64 attachments are moved into
 * a private temporary directory and replaced in the message by a file id reference; agents fetch or
 * delete stored files with {@code get_file} and {@code delete_file} protocol messages, and get a
 * response carrying the request's message id as {@code request_id}.
 *
 * This protocol does not deliver anything itself; it records and rewrites, and the caller routes.
 * History and membership tolerate concurrent delivery from several connections.
 */
public class SimpleMessagingProtocol extends AbstractNetworkProtocol {
	public final static String PROTOCOL_NAME = "simple_messaging";

	public final static String ACTION_GET_FILE                = "get_file";
	public final static String ACTION_DELETE_FILE             = "delete_file";
	public final static String ACTION_FILE_DOWNLOAD_RESPONSE  = "file_download_response";
	public final static String ACTION_FILE_DELETION_RESPONSE  = "file_deletion_response";

	public final static String ERROR_FILE_NOT_FOUND = "File not found";

	protected final MessageHistory history;
	protected final FileStore fileStore;

	public SimpleMessagingProtocol() throws IOException {
		this(ConfigDefaults.getActiveDefaults());
	}

	public SimpleMessagingProtocol(ConfigFile config) throws IOException {
		super(PROTOCOL_NAME);
		this.history = new MessageHistory(
				config.getInt("protocol.messaging.maxHistorySize"),
				config.getInt("protocol.messaging.historyTrimBatchSize"));
		this.fileStore = FileStore.createTemporary(config.getString("protocol.messaging.storagePrefix"));
		logger.info("Protocol {}: File storage at {}", name, fileStore.getRoot());
	}

	@Override
	public boolean shutdown() {
		activeAgents.clear();
		history.clear();

		try {
			fileStore.destroy();
			logger.info("Protocol {}: Cleaned up file storage {}", name, fileStore.getRoot());
		} catch(IOException exc) {
			logger.error("Protocol {}: Error cleaning up file storage {}", name, fileStore.getRoot(), exc);
		}

		return true;
	}

	@Override
	public boolean registerAgent(String agentId, Map<String,Object> metadata) {
		try {
			fileStore.createAgentDirectory(agentId);
		} catch(IOException exc) {
			logger.error("Protocol {}: Unable to create storage for agent {}", name, agentId, exc);
			return false;
		}

		return super.registerAgent(agentId, metadata);
	}

	@Override
	public DirectMessage processDirectMessage(DirectMessage message) {
		history.add(message);
		if(hasAttachments(message)) {
			processFileAttachments(message);
		}

		logger.debug("Protocol {}: Processing direct message from {} to {}",
				name,
				message.getSenderId(),
				message.getTargetAgentId());
		return message;
	}

	@Override
	public BroadcastMessage processBroadcastMessage(BroadcastMessage message) {
		history.add(message);
		if(hasAttachments(message)) {
			processFileAttachments(message);
		}

		logger.debug("Protocol {}: Processing broadcast message from {}", name, message.getSenderId());
		return message;
	}

	@Override
	public void processProtocolMessage(ProtocolMessage message) {
		history.add(message);
		logger.debug("Protocol {}: Processing protocol message from {}", name, message.getSenderId());

		String fileId = fileIdOf(message);
		switch(message.getAction()) {
		case ACTION_GET_FILE:
			if(fileId != null) handleFileDownload(message.getSenderId(), fileId, message);
			break;
		case ACTION_DELETE_FILE:
			if(fileId != null) handleFileDeletion(message.getSenderId(), fileId, message);
			break;
		default:
			// not ours to answer
		}
	}

	/** Accepts a raw protocol message as JSON and runs it through {@link #processProtocolMessage}. */
	@Override
	public Optional<JsonNode> handleMessage(JsonNode message) {
		try {
			BaseMessage parsed = MessageParser.parse(message);
			if(parsed instanceof ProtocolMessage) {
				processProtocolMessage((ProtocolMessage) parsed);
				return Optional.empty();
			}
		} catch(JsonProcessingException exc) {
			logger.warn("Protocol {}: Unable to parse message {}", name, message, exc);
			return Optional.empty();
		}

		return super.handleMessage(message);
	}

	protected boolean hasAttachments(BaseMessage message) {
		Object files = message.getContent().get("files");
		return files instanceof List && !((List<?>) files).isEmpty();
	}

	protected String fileIdOf(ProtocolMessage message) {
		Object fileId = message.getContent().get("file_id");
		if(!(fileId instanceof String) || ((String) fileId).isEmpty()) return null;
		return (String) fileId;
	}

	/**
	 * Store each inline attachment and put a file reference in its place. Entries that fail to decode or
	 * write, or whose filename is not a non-empty string, are logged and left out; entries with no inline
	 * content are kept as they are.
	 */
	protected void processFileAttachments(BaseMessage message) {
		List<?> files = (List<?>) message.getContent().get("files");
		ArrayList<Object> processedFiles = new ArrayList<>(files.size());

		for(Object entry : files) {
			if(!(entry instanceof Map)) {
				processedFiles.add(entry);
				continue;
			}

			Map<?,?> fileData = (Map<?,?>) entry;
			if(!fileData.containsKey("content") || !fileData.containsKey("filename")) {
				processedFiles.add(entry);
				continue;
			}

			try {
				FileRecord record = storeAttachment(fileData);
				processedFiles.add(record.toAttachmentEntry());
				logger.debug("Protocol {}: Saved file attachment {} with id {}",
						name,
						record.getFilename(),
						record.getFileId());
			} catch(IOException|IllegalArgumentException exc) {
				logger.error("Protocol {}: Error saving file attachment {} from message {}",
						name,
						fileData.get("filename"),
						message.getMessageId(),
						exc);
			}
		}

		HashMap<String,Object> content = new HashMap<>(message.getContent());
		content.put("files", processedFiles);
		message.setContent(content);
	}

	protected FileRecord storeAttachment(Map<?,?> fileData) throws IOException {
		Object encoded = fileData.get("content");
		if(!(encoded instanceof String)) {
			throw new IllegalArgumentException("attachment content is not a base64 string");
		}

		Object filename = fileData.get("filename");
		if(!(filename instanceof String) || ((String) filename).isEmpty()) {
			throw new IllegalArgumentException("attachment filename is not a non-empty string");
		}
		
		Object mimeType = fileData.get("mime_type");
		byte[] data = Util.decode64((String) encoded);
		return fileStore.store(
				(String) filename,
				mimeType instanceof String ? (String) mimeType : FileStore.DEFAULT_MIME_TYPE,
				data);
	}

	protected void handleFileDownload(String agentId, String fileId, ProtocolMessage request) {
		LinkedHashMap<String,Object> content = new LinkedHashMap<>();
		content.put("action", ACTION_FILE_DOWNLOAD_RESPONSE);

		try {
			byte[] data = fileStore.read(fileId);
			content.put("success", true);
			content.put("file_id", fileId);
			content.put("content", Util.encode64(data));
			logger.debug("Protocol {}: Sending file {} to agent {}", name, fileId, agentId);
		} catch(ENOENTException exc) {
			content.put("success", false);
			content.put("error", ERROR_FILE_NOT_FOUND);
		} catch(IOException exc) {
			content.put("success", false);
			content.put("error", "Error reading file: " + exc.getMessage());
			logger.error("Protocol {}: Error sending file {} to agent {}", name, fileId, agentId, exc);
		}

		content.put("request_id", request.getMessageId());
		sendResponse(agentId, content);
	}

	protected void handleFileDeletion(String agentId, String fileId, ProtocolMessage request) {
		LinkedHashMap<String,Object> content = new LinkedHashMap<>();
		content.put("action", ACTION_FILE_DELETION_RESPONSE);

		try {
			fileStore.delete(fileId);
			content.put("success", true);
			content.put("file_id", fileId);
			logger.debug("Protocol {}: Deleted file {} for agent {}", name, fileId, agentId);
		} catch(ENOENTException exc) {
			content.put("success", false);
			content.put("error", ERROR_FILE_NOT_FOUND);
		} catch(IOException exc) {
			content.put("success", false);
			content.put("error", "Error deleting file: " + exc.getMessage());
			logger.error("Protocol {}: Error deleting file {} for agent {}", name, fileId, agentId, exc);
		}

		content.put("request_id", request.getMessageId());
		sendResponse(agentId, content);
	}

	protected void sendResponse(String agentId, Map<String,Object> content) {
		OutboundSender sender = network;
		if(sender == null) {
			logger.error("Protocol {}: Not registered with a network; dropping {} for agent {}",
					name,
					content.get("action"),
					agentId);
			return;
		}

		ProtocolMessage response = new ProtocolMessage(
				sender.getNetworkId(),
				PROTOCOL_NAME,
				content,
				Direction.OUTBOUND,
				agentId);
		if(!sender.sendProtocolMessage(response)) {
			logger.warn("Protocol {}: Network {} failed to send {} to agent {}",
					name,
					sender.getNetworkId(),
					content.get("action"),
					agentId);
		}
	}

	@Override
	public Map<String,Object> getState() {
		int fileCount = 0;
		try {
			fileCount = fileStore.countFiles();
		} catch(IOException exc) {
			logger.warn("Protocol {}: Unable to count stored files in {}", name, fileStore.getRoot(), exc);
		}

		LinkedHashMap<String,Object> state = new LinkedHashMap<>();
		state.put("active_agents", activeAgents.size());
		state.put("message_history_size", history.size());
		state.put("stored_files", fileCount);
		state.put("file_storage_path", fileStore.getRoot().toString());
		return state;
	}

	public MessageHistory getHistory() {
		return history;
	}

	public FileStore getFileStore() {
		return fileStore;
	}
}
