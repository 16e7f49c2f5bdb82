/**
 * Reusable fixtures: sample events, a sample aggregate and a recording handler.
 */
package com.ryuqq.olympus.testkit.fixture;
