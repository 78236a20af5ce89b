package io.nosqlbench.divstats.engine;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.divstats.io.DivstatsGsonConfig;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/// Fingerprints partition keys.
///
/// A key's hash is the lowercase hex MD5 digest of its compact JSON encoding, so
/// equal keys hash equally across runs and processes.
public final class KeyHasher {

    private KeyHasher() {
    }

    /// Hashes one key.
    ///
    /// @param key the key
    /// @return 32 lowercase hex characters
    public static String hash(Object key) {
        Objects.requireNonNull(key, "key cannot be null");
        String json = DivstatsGsonConfig.compactGson().toJson(key);
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(json.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // MD5 is always available
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    /// Hashes keys in order.
    ///
    /// @param keys the keys
    /// @return one hash per key, same order
    public static List<String> hashAll(List<?> keys) {
        List<String> hashes = new ArrayList<>(keys.size());
        for (Object key : keys) {
            hashes.add(hash(key));
        }
        return hashes;
    }
}
