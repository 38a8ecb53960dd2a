/**
 * Persisted key-value stores used for commissioning identities and the node storage.
 * <ul>
 *   <li>{@link com.hubbridge.storage.StorageManager} / {@link com.hubbridge.storage.StorageContext} – store boundary</li>
 *   <li>{@link com.hubbridge.storage.JsonFileStorageManager} – single JSON file with backup copy</li>
 *   <li>{@link com.hubbridge.storage.DirectoryStorageManager} – one JSON file per context</li>
 *   <li>{@link com.hubbridge.storage.RedisStorageManager} – Redis hashes through Jedis</li>
 * </ul>
 */
package com.hubbridge.storage;
