/**
 * Vector store provider contracts and registry. Providers translate the gateway's uniform calls into a
 * vendor REST dialect and back.
 * <ul>
 *   <li>{@link com.vecgate.plugin.VectorStoreProvider} – build/parse operations plus auth and base URL resolution</li>
 *   <li>{@link com.vecgate.plugin.VectorStoreProviderFactory} – SPI for pluggable discovery (ServiceLoader)</li>
 *   <li>{@link com.vecgate.plugin.VectorStoreProviderRegistry} – lookup by provider name</li>
 *   <li>{@link com.vecgate.plugin.EmbeddingPlugin} – embedding capability used for search queries</li>
 *   <li>{@link com.vecgate.plugin.LoggingContext} – caller-owned call details</li>
 *   <li>{@link com.vecgate.plugin.ProviderErrorFactory} – builds the provider error from status and headers</li>
 * </ul>
 */
package com.vecgate.plugin;
