/**
 * Statistical primitives: median, MAD, sample quantiles and the Student's t
 * quantile function behind the ESD critical values.
 *
 * @since 1.0.0
 */
package com.seasonalesd.core.stats;
