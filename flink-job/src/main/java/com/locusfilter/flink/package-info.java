/**
 * Flink streaming job that runs configured filters over loci read from
 * Kafka and publishes the resulting filter reports.
 */
package com.locusfilter.flink;
