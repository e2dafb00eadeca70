package im.arun.opndossier.service;

import im.arun.opndossier.TestConfigurations;
import im.arun.opndossier.config.WalkerConfig;
import im.arun.opndossier.model.DocumentNode;
import im.arun.opndossier.util.TreeUtils;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DossierServiceTest {

    @Test
    void shouldBuildDocumentForFullConfiguration() {
        DossierService service = new DossierService();

        DocumentNode root = service.buildDocument(TestConfigurations.full());

        assertThat(root.getTitle()).isEqualTo("OPNsense Configuration");
        assertThat(root.getBody()).containsExactly(
            "Version: 1.0", "Trigger Initial Wizard: enabled", "Theme: opnsense");
        assertThat(TreeUtils.findPath(root, "Interfaces", "Items", "wan")).isPresent();
        assertThat(TreeUtils.findPath(root, "Interfaces", "Items", "lan")).isPresent();
        assertThat(TreeUtils.findPath(root, "Dhcpd", "Lan", "Range").orElseThrow().getBody())
            .containsExactly("From: 192.168.1.100", "To: 192.168.1.199");
        assertThat(TreeUtils.findPath(root, "Rrd").orElseThrow().getBody()).containsExactly("Enable: enabled");
        assertThat(TreeUtils.maxLevel(root)).isLessThanOrEqualTo(6);
    }

    @Test
    void shouldUseSuppliedConfiguration() {
        WalkerConfig config = new WalkerConfig();
        config.setRootTitle("Firewall Dossier");
        config.setMaxDepth(2);

        DossierService service = new DossierService(config);
        DocumentNode root = service.buildDocument(TestConfigurations.full());

        assertThat(service.getConfig()).isSameAs(config);
        assertThat(root.getTitle()).isEqualTo("Firewall Dossier");
        assertThat(TreeUtils.maxLevel(root)).isEqualTo(2);
    }

    @Test
    void shouldRejectMissingConfiguration() {
        assertThatThrownBy(() -> new DossierService().buildDocument(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("opnsense");
    }
}
