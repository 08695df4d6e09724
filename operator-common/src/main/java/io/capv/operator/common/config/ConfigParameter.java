/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.config;

import io.capv.operator.common.InvalidConfigurationException;

import java.util.HashMap;
import java.util.Map;

/**
 * Models a configuration parameter, identified by a unique key, which may be required, and if not may have a default value.
 * Optional parameters without a default value implicitly have a null default.
 * The key is also the name of the environment variable from which the value is read.
 *
 * @param key           Configuration parameter name/key
 * @param <T>           Type of object
 * @param type          Parser of the value
 * @param defaultValue  Default value of the configuration parameter
 * @param required      If the value is required or not
 */
public record ConfigParameter<T>(String key, ConfigParameterParser<T> type, String defaultValue, boolean required) {
    /**
     * Marker for indication "all namespaces" => this is used when creating watches to create a cluster wide watch.
     */
    public final static String ANY_NAMESPACE = "*";

    /**
     * Creates a required parameter and registers it in the map
     *
     * @param key   Configuration parameter name/key
     * @param type  Parser of the value
     * @param map   Map with all parameters
     *
     * @param <T>   Type of the value
     *
     * @return  The registered parameter
     */
    public static <T> ConfigParameter<T> required(String key, ConfigParameterParser<T> type, Map<String, ConfigParameter<?>> map) {
        ConfigParameter<T> parameter = new ConfigParameter<>(key, type, null, true);
        map.put(key, parameter);
        return parameter;
    }

    /**
     * Creates an optional parameter and registers it in the map
     *
     * @param key           Configuration parameter name/key
     * @param type          Parser of the value
     * @param defaultValue  Default value used when the parameter is not set. Can be null.
     * @param map           Map with all parameters
     *
     * @param <T>   Type of the value
     *
     * @return  The registered parameter
     */
    public static <T> ConfigParameter<T> optional(String key, ConfigParameterParser<T> type, String defaultValue, Map<String, ConfigParameter<?>> map) {
        ConfigParameter<T> parameter = new ConfigParameter<>(key, type, defaultValue, false);
        map.put(key, parameter);
        return parameter;
    }

    /**
     * Parses the values of all known parameters. Keys of the environment which are not known parameters are ignored.
     * Empty values are treated as unset.
     *
     * @param envVarMap          Map containing values entered by user.
     * @param configParameterMap Map containing all the known parameters
     *
     * @return  Map with the parsed values
     */
    public static Map<String, Object> define(Map<String, String> envVarMap, Map<String, ConfigParameter<?>> configParameterMap) {
        Map<String, Object> generatedMap = new HashMap<>(configParameterMap.size());

        for (ConfigParameter<?> parameter : configParameterMap.values()) {
            generatedMap.put(parameter.key(), get(envVarMap, parameter));
        }

        return generatedMap;
    }

    private static <T> T get(Map<String, String> map, ConfigParameter<T> parameter) {
        String value = map.get(parameter.key());

        if (value == null || value.isEmpty()) {
            value = parameter.defaultValue();
        }

        if (value != null) {
            try {
                return parameter.type().parse(value);
            } catch (InvalidConfigurationException e) {
                throw new InvalidConfigurationException("Invalid value of " + parameter.key() + ": " + e.getMessage(), e);
            }
        } else if (parameter.required()) {
            throw new InvalidConfigurationException("Config value: " + parameter.key() + " is mandatory");
        } else {
            return null;
        }
    }
}
