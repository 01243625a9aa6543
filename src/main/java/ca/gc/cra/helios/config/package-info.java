/**
 * Configuration loading, typed settings, and the composition root.
 * <p><strong>Precedence:</strong> CLI {@code key=value} &gt; YAML section for the command &gt; YAML {@code common}
 * &gt; embedded defaults.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.helios.config;
