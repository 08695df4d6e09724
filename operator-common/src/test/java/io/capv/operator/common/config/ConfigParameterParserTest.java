/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.config;

import io.capv.operator.common.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static io.capv.operator.common.config.ConfigParameterParser.BOOLEAN;
import static io.capv.operator.common.config.ConfigParameterParser.DURATION;
import static io.capv.operator.common.config.ConfigParameterParser.HTTP_URI;
import static io.capv.operator.common.config.ConfigParameterParser.INTEGER;
import static io.capv.operator.common.config.ConfigParameterParser.LONG;
import static io.capv.operator.common.config.ConfigParameterParser.NAMESPACE;
import static io.capv.operator.common.config.ConfigParameterParser.NON_EMPTY_STRING;
import static io.capv.operator.common.config.ConfigParameterParser.POSITIVE_DURATION;
import static io.capv.operator.common.config.ConfigParameterParser.STRING;
import static io.capv.operator.common.config.ConfigParameterParser.strictlyPositive;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ConfigParameterParserTest {
    @Test
    public void testValidValues() {
        assertThat(STRING.parse("vcenter.example.com"), is("vcenter.example.com"));
        assertThat(NON_EMPTY_STRING.parse("admin"), is("admin"));
        assertThat(LONG.parse("600000"), is(600_000L));
        assertThat(INTEGER.parse("8081"), is(8081));
        assertThat(strictlyPositive(INTEGER).parse("10"), is(10));
        assertThat(DURATION.parse("10000"), is(Duration.ofSeconds(10)));
        assertThat(POSITIVE_DURATION.parse("1000"), is(Duration.ofSeconds(1)));
        assertThat(BOOLEAN.parse("TRUE"), is(true));
        assertThat(HTTP_URI.parse("https://nsxt.example.com/api"), is(URI.create("https://nsxt.example.com/api")));
        assertThat(NAMESPACE.parse("*"), is("*"));
        assertThat(NAMESPACE.parse("capv-system"), is("capv-system"));
    }

    @Test
    public void testInvalidValues() {
        assertThrows(InvalidConfigurationException.class, () -> NON_EMPTY_STRING.parse(""));
        assertThrows(InvalidConfigurationException.class, () -> LONG.parse("ten"));
        assertThrows(InvalidConfigurationException.class, () -> INTEGER.parse("1.5"));
        assertThrows(InvalidConfigurationException.class, () -> strictlyPositive(INTEGER).parse("0"));
        assertThrows(InvalidConfigurationException.class, () -> POSITIVE_DURATION.parse("-5"));
        assertThrows(InvalidConfigurationException.class, () -> BOOLEAN.parse("yes"));
        assertThrows(InvalidConfigurationException.class, () -> HTTP_URI.parse("ftp://example.com"));
        assertThrows(InvalidConfigurationException.class, () -> NAMESPACE.parse("Capv_System"));
    }

    @Test
    public void testDefine() {
        Map<String, ConfigParameter<?>> parameters = new HashMap<>();
        ConfigParameter.optional("CAPV_WORK_QUEUE_SIZE", strictlyPositive(INTEGER), "1024", parameters);
        ConfigParameter.optional("CAPV_DEFAULT_SERVER", STRING, null, parameters);
        ConfigParameter.required("CAPV_NAMESPACE", NAMESPACE, parameters);

        Map<String, Object> values = ConfigParameter.define(Map.of("CAPV_NAMESPACE", "capv-system", "CAPV_WORK_QUEUE_SIZE", "", "PATH", "/usr/bin"), parameters);

        assertThat(values.get("CAPV_WORK_QUEUE_SIZE"), is(1024));
        assertThat(values.get("CAPV_DEFAULT_SERVER"), is(nullValue()));
        assertThat(values.get("CAPV_NAMESPACE"), is("capv-system"));
        assertThat(values.containsKey("PATH"), is(false));
    }

    @Test
    public void testDefineMissingRequired() {
        Map<String, ConfigParameter<?>> parameters = new HashMap<>();
        ConfigParameter.required("CAPV_NAMESPACE", NAMESPACE, parameters);

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, () -> ConfigParameter.define(Map.of(), parameters));
        assertThat(e.getMessage(), containsString("CAPV_NAMESPACE"));
    }
}
