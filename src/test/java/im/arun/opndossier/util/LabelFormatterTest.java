package im.arun.opndossier.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LabelFormatterTest {

    @Test
    void shouldLeaveSingleWordsAlone() {
        assertThat(LabelFormatter.formatLabel("Hostname")).isEqualTo("Hostname");
        assertThat(LabelFormatter.formatLabel("IPAddr")).isEqualTo("IPAddr");
        assertThat(LabelFormatter.formatLabel("XMLName")).isEqualTo("XMLName");
    }

    @Test
    void shouldSplitCamelCase() {
        assertThat(LabelFormatter.formatLabel("DisableConsoleMenu")).isEqualTo("Disable Console Menu");
        assertThat(LabelFormatter.formatLabel("LoadBalancer")).isEqualTo("Load Balancer");
    }

    @Test
    void shouldKeepAcronymsWhole() {
        assertThat(LabelFormatter.formatLabel("IPv6Allow")).isEqualTo("IPv6 Allow");
        assertThat(LabelFormatter.formatLabel("DisableVLANHWFilter")).isEqualTo("Disable VLANHWFilter");
        assertThat(LabelFormatter.formatLabel("DisableNATReflection")).isEqualTo("Disable NATReflection");
    }

    @Test
    void shouldCapitalizeLowerCamelIdentifiers() {
        assertThat(LabelFormatter.formatLabel("hostname")).isEqualTo("Hostname");
        assertThat(LabelFormatter.formatLabel("powerdAcMode")).isEqualTo("Powerd Ac Mode");
    }

    @Test
    void shouldHandleEmptyInput() {
        assertThat(LabelFormatter.formatLabel("")).isEmpty();
        assertThat(LabelFormatter.formatLabel(null)).isEmpty();
    }

    @Test
    void shouldFormatIndices() {
        assertThat(LabelFormatter.formatIndex(0)).isEqualTo("[0]");
        assertThat(LabelFormatter.formatIndex(10)).isEqualTo("[10]");
        assertThat(LabelFormatter.formatIndex(99)).isEqualTo("[99]");
    }
}
