/**
 * The remediation validation loop and the seams around it.
 *
 * <p>{@link com.purchasingpower.remediation.core.RemediationLoop} drives three
 * collaborators, each behind an interface so the state machine can run against fakes:
 * <ul>
 *   <li>{@link com.purchasingpower.remediation.core.PromptBuilder} - request + history to prompt</li>
 *   <li>{@link com.purchasingpower.remediation.core.GenerationPort} - prompt to code</li>
 *   <li>{@link com.purchasingpower.remediation.core.ScanPort} - code to findings</li>
 * </ul>
 *
 * <p>Nothing in this package keeps state between requests.
 */
package com.purchasingpower.remediation.core;
