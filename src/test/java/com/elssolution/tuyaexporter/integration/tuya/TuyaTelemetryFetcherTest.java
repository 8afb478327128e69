package com.elssolution.tuyaexporter.integration.tuya;

import com.elssolution.tuyaexporter.MutableClock;
import com.elssolution.tuyaexporter.domain.BatteryState;
import com.elssolution.tuyaexporter.domain.Device;
import com.elssolution.tuyaexporter.domain.FetchException;
import com.elssolution.tuyaexporter.domain.Reading;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class TuyaTelemetryFetcherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Device device = new Device("bf01", "Kitchen");
    private TuyaCloudClient client;
    private TuyaTelemetryFetcher fetcher;

    private static final String SPEC = """
            {"category":"wsdcg","status":[
              {"code":"va_temperature","type":"Integer","values":"{\\"unit\\":\\"℃\\",\\"min\\":-200,\\"max\\":600,\\"scale\\":1,\\"step\\":1}"},
              {"code":"va_humidity","type":"Integer","values":"{\\"unit\\":\\"%\\",\\"min\\":0,\\"max\\":100,\\"scale\\":0,\\"step\\":1}"},
              {"code":"battery_state","type":"Enum","values":"{\\"range\\":[\\"low\\",\\"middle\\",\\"high\\"]}"}
            ]}""";

    private static JsonNode json(String s) throws Exception {
        return JSON.readTree(s);
    }

    @BeforeEach
    void setUp() throws Exception {
        client = mock(TuyaCloudClient.class);
        fetcher = new TuyaTelemetryFetcher(client, new MutableClock(NOW));
        when(client.getSpecification("bf01")).thenReturn(json(SPEC));
    }

    @Test
    void maps_temperature_humidity_and_battery() throws Exception {
        when(client.getDevice("bf01")).thenReturn(json("""
                {"id":"bf01","name":"TH sensor","update_time":1714557000,"status":[
                  {"code":"va_temperature","value":215},
                  {"code":"va_humidity","value":48},
                  {"code":"battery_state","value":"middle"}
                ]}"""));

        Reading r = fetcher.fetch(device);

        assertThat(r.temperatureCelsius()).isEqualTo(21.5);
        assertThat(r.humidityPercent()).isEqualTo(48.0);
        assertThat(r.batteryState()).isEqualTo(BatteryState.MIDDLE);
        assertThat(r.observedAt()).isEqualTo(Instant.ofEpochSecond(1714557000));
        assertThat(r.fetchedAt()).isEqualTo(NOW);
    }

    @Test
    void temperature_in_tenths_without_spec_entry() throws Exception {
        when(client.getSpecification("bf01")).thenReturn(json("{\"status\":[]}"));
        when(client.getDevice("bf01")).thenReturn(json("""
                {"status":[{"code":"temp_current","value":215},{"code":"humidity_value","value":"55"}]}"""));

        Reading r = fetcher.fetch(device);

        assertThat(r.temperatureCelsius()).isEqualTo(21.5);
        assertThat(r.humidityPercent()).isEqualTo(55.0);
    }

    @Test
    void scale_from_specification_is_applied() throws Exception {
        when(client.getSpecification("bf01")).thenReturn(json("""
                {"status":[{"code":"humidity_value","type":"Integer","values":"{\\"scale\\":1}"}]}"""));
        when(client.getDevice("bf01")).thenReturn(json("""
                {"status":[{"code":"humidity_value","value":553}]}"""));

        assertThat(fetcher.fetch(device).humidityPercent()).isEqualTo(55.3);
    }

    @Test
    void missing_fields_stay_absent() throws Exception {
        when(client.getDevice("bf01")).thenReturn(json("""
                {"status":[{"code":"switch_1","value":true},{"code":"va_humidity","value":"n/a"}]}"""));

        Reading r = fetcher.fetch(device);

        assertThat(r.temperatureCelsius()).isNull();
        assertThat(r.humidityPercent()).isNull();
        assertThat(r.batteryState()).isEqualTo(BatteryState.UNKNOWN);
        assertThat(r.observedAt()).isEqualTo(NOW); // no timestamp at all → fetch time
    }

    @Test
    void non_finite_strings_stay_absent() throws Exception {
        when(client.getDevice("bf01")).thenReturn(json("""
                {"update_time":"Infinity","status":[
                  {"code":"va_temperature","value":"NaN"},
                  {"code":"va_humidity","value":"Infinity"}
                ]}"""));

        Reading r = fetcher.fetch(device);

        assertThat(r.temperatureCelsius()).isNull();
        assertThat(r.humidityPercent()).isNull();
        assertThat(r.observedAt()).isEqualTo(NOW);
    }

    @Test
    void unrecognised_battery_value_is_unknown() throws Exception {
        when(client.getDevice("bf01")).thenReturn(json("""
                {"status":[{"code":"battery_state","value":"full"}]}"""));

        assertThat(fetcher.fetch(device).batteryState()).isEqualTo(BatteryState.UNKNOWN);
    }

    @Test
    void newest_data_point_timestamp_wins_over_update_time() throws Exception {
        when(client.getDevice("bf01")).thenReturn(json("""
                {"update_time":1714557000,"status":[
                  {"code":"va_temperature","value":200,"t":1714557100000},
                  {"code":"va_humidity","value":40,"t":1714557200000},
                  {"code":"switch_1","value":true,"t":1714559999000}
                ]}"""));

        assertThat(fetcher.fetch(device).observedAt()).isEqualTo(Instant.ofEpochMilli(1714557200000L));
    }

    @Test
    void specification_is_fetched_once_per_device() throws Exception {
        when(client.getDevice("bf01")).thenReturn(json("{\"status\":[]}"));

        fetcher.fetch(device);
        fetcher.fetch(device);

        verify(client, times(1)).getSpecification("bf01");
        verify(client, times(2)).getDevice("bf01");
    }

    @Test
    void failed_specification_is_retried_next_time() throws Exception {
        when(client.getDevice("bf01")).thenReturn(json("{\"status\":[{\"code\":\"va_temperature\",\"value\":215}]}"));
        when(client.getSpecification("bf01"))
                .thenThrow(new FetchException("bf01", FetchException.Kind.NETWORK, "timeout"))
                .thenReturn(json(SPEC));

        assertThatThrownBy(() -> fetcher.fetch(device))
                .isInstanceOf(FetchException.class)
                .satisfies(e -> assertThat(((FetchException) e).getKind()).isEqualTo(FetchException.Kind.NETWORK));
        assertThat(fetcher.fetch(device).temperatureCelsius()).isEqualTo(21.5);
    }

    @Test
    void payload_without_status_is_malformed() throws Exception {
        when(client.getDevice("bf01")).thenReturn(json("{\"id\":\"bf01\"}"));

        assertThatThrownBy(() -> fetcher.fetch(device))
                .isInstanceOf(FetchException.class)
                .satisfies(e -> {
                    FetchException fe = (FetchException) e;
                    assertThat(fe.getKind()).isEqualTo(FetchException.Kind.MALFORMED_RESPONSE);
                    assertThat(fe.getDeviceId()).isEqualTo("bf01");
                });
    }

    @Test
    void client_errors_propagate_unchanged() throws Exception {
        FetchException auth = new FetchException("bf01", FetchException.Kind.AUTH, "HTTP 401");
        when(client.getDevice("bf01")).thenThrow(auth);

        assertThatThrownBy(() -> fetcher.fetch(device)).isSameAs(auth);
    }
}
