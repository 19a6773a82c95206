package org.javai.schemeload.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@link LoaderSettings} from YAML. Keys that are absent keep their value from
 * {@link LoaderSettings#defaults()}.
 */
public class LoaderSettingsParser {

	private static final Logger logger = LoggerFactory.getLogger(LoaderSettingsParser.class);

	public static final String DEFAULT_RESOURCE = "schemeload.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the built-in defaults when it is absent.
	 */
	public LoaderSettings loadDefault() {
		return loadResource(DEFAULT_RESOURCE, LoaderSettingsParser.class.getClassLoader());
	}

	public LoaderSettings loadResource(String resourcePath, ClassLoader loader) {
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				logger.debug("No {} on the classpath; using built-in loader settings", resourcePath);
				return LoaderSettings.defaults();
			}
			return parse(is);
		} catch (LoaderSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new LoaderSettingsException("Failed to load settings from resource: " + resourcePath, e);
		}
	}

	public LoaderSettings parse(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (LoaderSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new LoaderSettingsException("Failed to load settings from path: " + path, e);
		}
	}

	public LoaderSettings parse(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (YAMLException e) {
			throw new LoaderSettingsException("Failed to parse settings from input stream", e);
		}
	}

	public LoaderSettings parse(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (YAMLException e) {
			throw new LoaderSettingsException("Failed to parse settings from reader", e);
		}
	}

	public LoaderSettings parseString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (YAMLException e) {
			throw new LoaderSettingsException("Failed to parse settings from string", e);
		}
	}

	private LoaderSettings build(Object document) {
		LoaderSettings defaults = LoaderSettings.defaults();
		if (document == null) {
			return defaults;
		}
		if (!(document instanceof Map<?, ?> data)) {
			throw new LoaderSettingsException("Settings document must be a mapping but was " + document.getClass().getSimpleName());
		}

		Path includeDirectory = data.containsKey("include-dirname")
				? Path.of(requireString(data, "include-dirname"))
				: defaults.includeDirectory();
		int previewLength = data.containsKey("preview-length")
				? requireInt(data, "preview-length")
				: defaults.previewLength();
		boolean foldCase = data.containsKey("fold-case")
				? requireBoolean(data, "fold-case")
				: defaults.foldCase();
		String prelude = data.containsKey("prelude")
				? optionalString(data, "prelude")
				: defaults.prelude();
		List<String> compatDefinitions = data.containsKey("compat-definitions")
				? stringList(data.get("compat-definitions"), "compat-definitions")
				: defaults.compatDefinitions();
		Map<String, InclusionMode> operators = data.containsKey("inclusion-operators")
				? inclusionOperators(data.get("inclusion-operators"))
				: defaults.inclusionOperators();
		Map<String, Set<String>> skips = data.containsKey("skip-definitions")
				? skipDefinitions(data.get("skip-definitions"))
				: defaults.skipDefinitions();

		return new LoaderSettings(includeDirectory, previewLength, foldCase, prelude, compatDefinitions,
				operators, skips);
	}

	private Map<String, InclusionMode> inclusionOperators(Object value) {
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map<?, ?> map)) {
			throw new LoaderSettingsException("inclusion-operators must be a mapping of operator to mode");
		}
		Map<String, InclusionMode> result = new LinkedHashMap<>();
		map.forEach((operator, mode) -> result.put(String.valueOf(operator), InclusionMode.fromConfig(String.valueOf(mode))));
		return result;
	}

	private Map<String, Set<String>> skipDefinitions(Object value) {
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map<?, ?> map)) {
			throw new LoaderSettingsException("skip-definitions must be a mapping of file name to names");
		}
		Map<String, Set<String>> result = new LinkedHashMap<>();
		map.forEach((file, names) -> result.put(String.valueOf(file),
				new LinkedHashSet<>(stringList(names, "skip-definitions." + file))));
		return result;
	}

	private static List<String> stringList(Object value, String key) {
		if (value == null) {
			return List.of();
		}
		if (!(value instanceof List<?> list)) {
			throw new LoaderSettingsException(key + " must be a list");
		}
		return list.stream().map(String::valueOf).toList();
	}

	private static String requireString(Map<?, ?> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			throw new LoaderSettingsException(key + " must not be empty");
		}
		return String.valueOf(value);
	}

	private static String optionalString(Map<?, ?> data, String key) {
		Object value = data.get(key);
		return value != null ? String.valueOf(value) : null;
	}

	private static int requireInt(Map<?, ?> data, String key) {
		Object value = data.get(key);
		if (value instanceof Number number) {
			return number.intValue();
		}
		throw new LoaderSettingsException(key + " must be an integer but was " + value);
	}

	private static boolean requireBoolean(Map<?, ?> data, String key) {
		Object value = data.get(key);
		if (value instanceof Boolean bool) {
			return bool;
		}
		throw new LoaderSettingsException(key + " must be true or false but was " + value);
	}
}
