package fr.imt.pbdeployer.business.model;

import java.util.List;

/**
 * @param applied remediations that ran, in order
 * @param failed  remediations that raised an error, with the error text
 * @param after   the diagnostic run made once the fixes were applied
 */
public record AutoFixResult(List<SafeRemediation> applied, List<String> failed, DiagnosticReport after) {
}
