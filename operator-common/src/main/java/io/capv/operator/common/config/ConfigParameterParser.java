/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.config;

import io.capv.operator.common.InvalidConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Turns the string value of an environment variable into a typed value
 *
 * @param <T>   Type of the value
 */
@FunctionalInterface
public interface ConfigParameterParser<T> {
    /**
     * @param configValue   Raw value
     *
     * @return  The typed value
     *
     * @throws InvalidConfigurationException When the value cannot be used
     */
    T parse(String configValue) throws InvalidConfigurationException;

    /**
     * Wraps a parser from the JDK which signals bad input with a {@link NumberFormatException}
     *
     * @param type      Type name used in the error
     * @param parser    The JDK parser
     * @param <T>       Type of the value
     *
     * @return  Parser throwing {@link InvalidConfigurationException} instead
     */
    static <T> ConfigParameterParser<T> number(String type, Function<String, T> parser) {
        return configValue -> {
            try {
                return parser.apply(configValue.trim());
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException("'" + configValue + "' is not a valid " + type, e);
            }
        };
    }

    /**
     * @param parser        Parser of the value
     * @param constraint    Constraint the parsed value has to meet
     * @param description   Description of the constraint used in the error
     * @param <T>           Type of the value
     *
     * @return  Parser rejecting the values which do not meet the constraint
     */
    static <T> ConfigParameterParser<T> require(ConfigParameterParser<T> parser, Predicate<T> constraint, String description) {
        return configValue -> {
            T value = parser.parse(configValue);
            if (!constraint.test(value)) {
                throw new InvalidConfigurationException("'" + configValue + "' " + description);
            }
            return value;
        };
    }

    static <T extends Number> ConfigParameterParser<T> strictlyPositive(ConfigParameterParser<T> parser) {
        return require(parser, value -> value.longValue() > 0, "has to be greater than zero");
    }

    ConfigParameterParser<String> STRING = configValue -> configValue;

    ConfigParameterParser<String> NON_EMPTY_STRING = configValue -> {
        if (configValue == null || configValue.isBlank()) {
            throw new InvalidConfigurationException("Value must not be empty");
        }
        return configValue;
    };

    ConfigParameterParser<Long> LONG = number("long", Long::parseLong);

    ConfigParameterParser<Integer> INTEGER = number("integer", Integer::parseInt);

    /**
     * Duration given as a number of milliseconds
     */
    ConfigParameterParser<Duration> DURATION = number("number of milliseconds", value -> Duration.ofMillis(Long.parseLong(value)));

    ConfigParameterParser<Duration> POSITIVE_DURATION = require(DURATION, value -> !value.isNegative() && !value.isZero(), "has to be a positive number of milliseconds");

    ConfigParameterParser<Boolean> BOOLEAN = configValue -> {
        String value = configValue.trim().toLowerCase();
        if (!Set.of("true", "false").contains(value)) {
            throw new InvalidConfigurationException("'" + configValue + "' is neither true nor false");
        }
        return Boolean.valueOf(value);
    };

    /**
     * Absolute http or https URI, such as the address of the load balancer appliance API
     */
    ConfigParameterParser<URI> HTTP_URI = configValue -> {
        URI uri;
        try {
            uri = new URI(configValue.trim());
        } catch (URISyntaxException e) {
            throw new InvalidConfigurationException("'" + configValue + "' is not a valid URI", e);
        }

        if (!"http".equals(uri.getScheme()) && !"https".equals(uri.getScheme())) {
            throw new InvalidConfigurationException("'" + configValue + "' is not a http or https URI");
        }
        return uri;
    };

    /**
     * A namespace name (RFC 1123 label) or {@link ConfigParameter#ANY_NAMESPACE}
     */
    ConfigParameterParser<String> NAMESPACE = configValue -> {
        String namespace = configValue.trim();
        if (!ConfigParameter.ANY_NAMESPACE.equals(namespace) && !Holder.DNS_LABEL.matcher(namespace).matches()) {
            throw new InvalidConfigurationException("'" + configValue + "' is neither a namespace name nor " + ConfigParameter.ANY_NAMESPACE);
        }
        return namespace;
    };

    /**
     * Constants of the parsers above
     */
    final class Holder {
        private static final Pattern DNS_LABEL = Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?");

        private Holder() {
        }
    }
}
