/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.exchange.gltf.material;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A glTF material with its {@code pbrMetallicRoughness} block flattened into the top level and its fields split into
 * plain values and texture references.
 *
 * @param scalars     field name to JSON value, anything that is not an object
 * @param textureRefs field name to the texture index it references
 * @author hal.hildebrand
 */
public record MaterialFields(Map<String, JsonNode> scalars, Map<String, Integer> textureRefs) {

    public static final String PBR_BLOCK = "pbrMetallicRoughness";

    public MaterialFields {
        scalars = Collections.unmodifiableMap(new LinkedHashMap<>(scalars));
        textureRefs = Collections.unmodifiableMap(new LinkedHashMap<>(textureRefs));
    }

    /**
     * Flatten one material entry. Fields of the PBR block override top level fields of the same name; objects that
     * are not texture references (extensions, extras) are dropped.
     */
    public static MaterialFields flatten(JsonNode material) {
        var fields = new LinkedHashMap<String, JsonNode>();
        material.fields().forEachRemaining(e -> {
            if (!PBR_BLOCK.equals(e.getKey())) {
                fields.put(e.getKey(), e.getValue());
            }
        });
        var pbr = material.path(PBR_BLOCK);
        if (pbr.isObject()) {
            pbr.fields().forEachRemaining(e -> fields.put(e.getKey(), e.getValue()));
        }

        var scalars = new LinkedHashMap<String, JsonNode>();
        var textures = new LinkedHashMap<String, Integer>();
        fields.forEach((key, value) -> {
            if (!value.isObject()) {
                scalars.put(key, value);
            } else if (value.has("index")) {
                textures.put(key, value.get("index").asInt());
            }
        });
        return new MaterialFields(scalars, textures);
    }
}
