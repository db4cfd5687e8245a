/**
 * Gateway configuration: caller-supplied {@link com.vecgate.config.ProviderParams},
 * environment access via {@link com.vecgate.config.EnvironmentLookup}, and
 * {@link com.vecgate.config.VectorStoreConfigurationException} for missing required inputs.
 */
package com.vecgate.config;
