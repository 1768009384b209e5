/**
 * Date/time helpers: timestamp formatting, granularity detection and
 * aggregation of second-level data.
 *
 * @since 1.0.0
 */
package com.seasonalesd.core.time;
