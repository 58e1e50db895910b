/**
 * Configuration loading and hot-reload support.
 *
 * <p>The YAML file is bound to {@link fr.lapetina.lineplanner.infrastructure.config.LinePlannerConfig}
 * and converted into the engine's immutable
 * {@link fr.lapetina.lineplanner.domain.placement.LayoutSettings}.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog, worker threads)</li>
 *   <li>{@code lanes} - Across-line offset of lanes A to D</li>
 *   <li>{@code spacing} - Machine pitch, section gap, fixture offsets</li>
 *   <li>{@code facing} - Yaw of the four canonical directions</li>
 *   <li>{@code sections} - Keyword tables for section and station classification</li>
 *   <li>{@code fixtures} - Optional transition fixtures</li>
 *   <li>{@code demand} - Defaults for requests without demand figures</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.lineplanner.infrastructure.config.ConfigLoader
 */
package fr.lapetina.lineplanner.infrastructure.config;
