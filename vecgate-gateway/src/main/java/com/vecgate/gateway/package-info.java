/**
 * Gateway entry point: {@link com.vecgate.gateway.VectorStoreGateway} selects a provider by name and runs
 * its request builders and response parsers around an HTTP call.
 */
package com.vecgate.gateway;
