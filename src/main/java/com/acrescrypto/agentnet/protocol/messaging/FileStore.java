package com.acrescrypto.agentnet.protocol.messaging;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.UUID;
import java.util.stream.Stream;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.agentnet.exceptions.ENOENTException;

/**
 * Flat directory of attachments, one file per attachment named by its file id, plus one (currently
 * empty) subdirectory per registered agent.
 */
public class FileStore {
	public final static String DEFAULT_MIME_TYPE = "application/octet-stream";
	
	private final Logger logger = LoggerFactory.getLogger(FileStore.class);
	protected final Path root;
	
	public static FileStore createTemporary(String prefix) throws IOException {
		return new FileStore(Files.createTempDirectory(prefix));
	}
	
	public FileStore(Path root) {
		this.root = root.toAbsolutePath().normalize();
	}
	
	/** File ids are random UUIDs; anything else can't name a stored file. */
	public static boolean isValidFileId(String fileId) {
		if(fileId == null) return false;
		try {
			return UUID.fromString(fileId).toString().equals(fileId);
		} catch(IllegalArgumentException exc) {
			return false;
		}
	}
	
	public FileRecord store(String filename, String mimeType, byte[] data) throws IOException {
		String fileId = UUID.randomUUID().toString();
		Path path = root.resolve(fileId);
		Files.write(path, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
		logger.debug("FileStore {}: Saved {} ({} bytes) as {}", root, filename, data.length, fileId);
		return new FileRecord(fileId, filename, data.length, mimeType == null ? DEFAULT_MIME_TYPE : mimeType, path);
	}
	
	public byte[] read(String fileId) throws IOException {
		Path path = pathFor(fileId);
		try {
			return Files.readAllBytes(path);
		} catch(NoSuchFileException exc) {
			throw new ENOENTException(fileId);
		}
	}
	
	public void delete(String fileId) throws IOException {
		Path path = pathFor(fileId);
		try {
			Files.delete(path);
		} catch(NoSuchFileException exc) {
			throw new ENOENTException(fileId);
		}
		
		logger.debug("FileStore {}: Deleted {}", root, fileId);
	}
	
	public boolean exists(String fileId) {
		if(!isValidFileId(fileId)) return false;
		return Files.isRegularFile(root.resolve(fileId));
	}
	
	/** @throws ENOENTException if the id is malformed or no such file is stored */
	protected Path pathFor(String fileId) throws ENOENTException {
		if(!isValidFileId(fileId)) throw new ENOENTException(String.valueOf(fileId));
		
		Path path = root.resolve(fileId);
		if(Files.exists(path) && !Files.isRegularFile(path)) throw new ENOENTException(fileId);
		return path;
	}
	
	public Path createAgentDirectory(String agentId) throws IOException {
		if(agentId == null || agentId.isEmpty()) {
			throw new IOException("agent id must not be empty");
		}
		
		Path dir = root.resolve(agentId).normalize();
		if(!root.equals(dir.getParent())) {
			throw new IOException("agent id " + agentId + " does not name a directory directly under " + root);
		}
		
		return Files.createDirectories(dir);
	}
	
	public int countFiles() throws IOException {
		if(!Files.isDirectory(root)) return 0;
		try(Stream<Path> entries = Files.list(root)) {
			return (int) entries.filter(Files::isRegularFile).count();
		}
	}
	
	/** Remove the whole tree. Does nothing if it is already gone. */
	public void destroy() throws IOException {
		FileUtils.deleteDirectory(root.toFile());
	}
	
	public Path getRoot() {
		return root;
	}
}
