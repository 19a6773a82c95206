package org.javai.schemeload.load;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders a {@link LoadReport} as JSON for the embedding application.
 */
public final class LoadReportJson {

	private static final ObjectMapper mapper = new ObjectMapper();

	private LoadReportJson() {
	}

	public static ObjectNode toTree(LoadReport report) {
		ObjectNode root = mapper.createObjectNode();
		root.put("file", report.file());
		root.put("totalForms", report.totalForms());
		root.put("failedForms", report.failedForms());
		root.put("skippedForms", report.skippedForms());
		root.put("aborted", report.aborted());

		ArrayNode operators = root.putArray("distinctFailingOperators");
		report.distinctFailingOperators().forEach(operators::add);

		ArrayNode diagnostics = root.putArray("diagnostics");
		for (LoadDiagnostic diagnostic : report.diagnostics()) {
			ObjectNode node = diagnostics.addObject();
			node.put("kind", diagnostic.kind().name());
			node.put("formPreview", diagnostic.formPreview());
			if (diagnostic.failingOperator() != null) {
				node.put("failingOperator", diagnostic.failingOperator());
			}
			node.put("message", diagnostic.message());
		}
		return root;
	}

	public static String toJson(LoadReport report) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(report));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize load report for " + report.file(), e);
		}
	}
}
