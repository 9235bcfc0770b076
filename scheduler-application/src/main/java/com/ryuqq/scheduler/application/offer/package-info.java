/**
 * Inbound port for offer rounds.
 */
package com.ryuqq.scheduler.application.offer;
