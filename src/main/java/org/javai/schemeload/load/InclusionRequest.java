package org.javai.schemeload.load;

import org.javai.schemeload.config.InclusionMode;

/**
 * A top-level inclusion form, reduced to what the inclusion handler needs.
 *
 * @param operator the inclusion operator, e.g. {@code kern-load}
 * @param fileName the bare file name argument, quotes removed
 * @param mode load now or only register
 * @param includingFile the script containing the form
 */
public record InclusionRequest(String operator, String fileName, InclusionMode mode, String includingFile) {
}
