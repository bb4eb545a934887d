/**
 * Sample work functions for tests.
 */
package com.ryuqq.timeguard.testkit.work;
