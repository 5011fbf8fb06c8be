/**
 * CLI entry points for the signing authority, executors, and reviewers.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, loads {@code hap.yaml},
 * configures logging, and invokes use cases wired by {@link ca.gc.cra.hap.config.CompositionRoot}.</p>
 * <p><strong>Output:</strong> results are {@code key=value} lines on stdout; diagnostics go through SLF4J.</p>
 * <p><strong>Security:</strong> private key material is never printed and is redacted from logged configuration.</p>
 */
package ca.gc.cra.hap.api;
