/**
 * YAML detector profiles: {@link com.seasonalesd.core.config.DetectorsConfig}
 * and its loader.
 *
 * @since 1.0.0
 */
package com.seasonalesd.core.config;
