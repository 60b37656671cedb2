package org.adcp.broker.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.fge.jsonpatch.JsonPatchException;
import com.github.fge.jsonpatch.mergepatch.JsonMergePatch;
import org.apache.commons.lang3.ObjectUtils;
import org.adcp.broker.exception.InvalidConfigurationException;
import org.adcp.broker.json.DecodeException;
import org.adcp.broker.json.JacksonMapper;

import java.util.Objects;

public class JsonMergeUtil {

    private final JacksonMapper mapper;

    public JsonMergeUtil(JacksonMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper);
    }

    /**
     * Deep-merges {@code override} over {@code base} following JSON merge patch rules
     * (RFC 7386): objects merge recursively, any other value in the override replaces
     * the base value. Either argument may be null.
     */
    public <T> T merge(T base, T override, Class<T> classToCast) {
        if (!ObjectUtils.allNotNull(base, override)) {
            return ObjectUtils.firstNonNull(override, base);
        }

        final JsonNode baseNode = mapper.mapper().valueToTree(base);
        final JsonNode overrideNode = mapper.mapper().valueToTree(override);
        try {
            return mapper.convertValue(mergeJsons(baseNode, overrideNode), classToCast);
        } catch (DecodeException e) {
            throw new InvalidConfigurationException(
                    "Can't convert merging result to class %s: %s".formatted(classToCast.getName(), e.getMessage()));
        }
    }

    public JsonNode mergeJsons(JsonNode baseNode, JsonNode overrideNode) {
        if (!ObjectUtils.allNotNull(baseNode, overrideNode)) {
            return ObjectUtils.firstNonNull(overrideNode, baseNode);
        }
        try {
            return JsonMergePatch.fromJson(overrideNode).apply(baseNode);
        } catch (JsonPatchException e) {
            throw new InvalidConfigurationException("Couldn't create merge patch for object " + overrideNode, e);
        }
    }
}
