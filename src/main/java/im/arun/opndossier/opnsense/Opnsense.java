package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.PresenceFlag;
import im.arun.opndossier.tree.Walkable;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of an OPNsense configuration ({@code <opnsense>} in config.xml).
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Opnsense implements Walkable {

    /** Name of the root XML element; identity only, never rendered. */
    private String xmlName = "opnsense";

    @JsonProperty("version")
    private String version;

    @JsonProperty("trigger_initial_wizard")
    private PresenceFlag triggerInitialWizard;

    @JsonProperty("theme")
    private String theme;

    @JsonProperty("sysctl")
    private List<SysctlItem> sysctl = new ArrayList<>();

    @JsonProperty("system")
    private OpnsenseSystem system = new OpnsenseSystem();

    @JsonProperty("interfaces")
    private Interfaces interfaces = new Interfaces();

    @JsonProperty("dhcpd")
    private Dhcpd dhcpd = new Dhcpd();

    @JsonProperty("unbound")
    private Unbound unbound = new Unbound();

    @JsonProperty("snmpd")
    private Snmpd snmpd = new Snmpd();

    @JsonProperty("nat")
    private Nat nat = new Nat();

    @JsonProperty("filter")
    private Filter filter = new Filter();

    @JsonProperty("rrd")
    private Rrd rrd = new Rrd();

    @JsonProperty("load_balancer")
    private LoadBalancer loadBalancer = new LoadBalancer();

    @JsonProperty("ntpd")
    private Ntpd ntpd = new Ntpd();

    @JsonProperty("widgets")
    private Widgets widgets = new Widgets();

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("XMLName", xmlName);
        visitor.visit("Version", version);
        visitor.visit("TriggerInitialWizard", triggerInitialWizard);
        visitor.visit("Theme", theme);
        visitor.visit("Sysctl", sysctl);
        visitor.visit("System", system);
        visitor.visit("Interfaces", interfaces);
        visitor.visit("Dhcpd", dhcpd);
        visitor.visit("Unbound", unbound);
        visitor.visit("Snmpd", snmpd);
        visitor.visit("Nat", nat);
        visitor.visit("Filter", filter);
        visitor.visit("Rrd", rrd);
        visitor.visit("LoadBalancer", loadBalancer);
        visitor.visit("Ntpd", ntpd);
        visitor.visit("Widgets", widgets);
    }
}
