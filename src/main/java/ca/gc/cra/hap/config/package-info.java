/**
 * Configuration loading ({@code hap.yaml}, CLI overrides, environment key fallbacks) and the
 * composition root that wires protocol services to adapters.
 */
package ca.gc.cra.hap.config;
