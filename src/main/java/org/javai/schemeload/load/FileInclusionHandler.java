package org.javai.schemeload.load;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.schemeload.config.LoaderSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link InclusionHandler} backed by the file system.
 * <p>
 * Relative names resolve against the configured include directory. Every file is loaded at most
 * once per session, which also stops circular inclusions; a file is marked as loaded before its
 * first form runs. Files named by a registering operator are only remembered, in order, until
 * {@link #loadRegistered(ScriptLoader)} is called.
 */
public class FileInclusionHandler implements InclusionHandler {

	private static final Logger logger = LoggerFactory.getLogger(FileInclusionHandler.class);

	private final Path includeDirectory;
	private final Set<String> loadedKeys = new HashSet<>();
	private final List<Path> loadedFiles = new ArrayList<>();
	private final List<Path> registeredFiles = new ArrayList<>();

	public FileInclusionHandler(LoaderSettings settings) {
		this(Objects.requireNonNull(settings, "settings must not be null").includeDirectory());
	}

	public FileInclusionHandler(Path includeDirectory) {
		this.includeDirectory = Objects.requireNonNull(includeDirectory, "includeDirectory must not be null");
	}

	@Override
	public void include(InclusionRequest request, ScriptLoader loader) {
		if (request.fileName() == null || request.fileName().isBlank()) {
			throw new InclusionException(request.operator() + ": missing filename");
		}
		Path path = resolve(request.fileName());
		if (!Files.isRegularFile(path)) {
			throw new InclusionException(request.operator() + ": file not found: " + path);
		}

		switch (request.mode()) {
			case REGISTER -> register(path);
			case LOAD -> {
				Optional<LoadReport> report = load(path, loader);
				if (report.isPresent() && report.get().aborted()) {
					throw new InclusionException(request.operator() + ": failed to load " + path + ": "
							+ report.get().diagnostics().get(0).message());
				}
			}
		}
	}

	/**
	 * Loads {@code file} unless it was loaded before in this session.
	 *
	 * @return the report, or empty when the file had already been loaded
	 */
	public Optional<LoadReport> load(Path file, ScriptLoader loader) {
		if (!loadedKeys.add(key(file))) {
			logger.debug("Already loaded, skipping: {}", file);
			return Optional.empty();
		}
		loadedFiles.add(file);
		return Optional.of(loader.loadFile(file));
	}

	/**
	 * Loads every registered file that has not been loaded yet, in registration order.
	 */
	@Override
	public List<LoadReport> loadRegistered(ScriptLoader loader) {
		List<LoadReport> reports = new ArrayList<>();
		for (Path file : List.copyOf(registeredFiles)) {
			load(file, loader).ifPresent(reports::add);
		}
		return reports;
	}

	public List<Path> registeredFiles() {
		return List.copyOf(registeredFiles);
	}

	public List<Path> loadedFiles() {
		return List.copyOf(loadedFiles);
	}

	/**
	 * Forgets which files were loaded or registered, e.g. when a new session starts.
	 */
	public void clearLoadedFiles() {
		loadedKeys.clear();
		loadedFiles.clear();
		registeredFiles.clear();
	}

	Path resolve(String fileName) {
		Path path = Path.of(fileName);
		return path.isAbsolute() ? path : includeDirectory.resolve(path);
	}

	private void register(Path path) {
		if (registeredFiles.stream().anyMatch(p -> key(p).equals(key(path)))) {
			logger.debug("Already registered: {}", path);
			return;
		}
		logger.debug("Registered for later load: {}", path);
		registeredFiles.add(path);
	}

	private static String key(Path path) {
		return path.toAbsolutePath().normalize().toString().toLowerCase(Locale.ROOT);
	}
}
