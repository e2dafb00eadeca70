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
 * The {@code <system>} section: identity, accounts, web GUI and tuning.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OpnsenseSystem implements Walkable {

    @JsonProperty("optimization")
    private String optimization;

    @JsonProperty("hostname")
    private String hostname;

    @JsonProperty("domain")
    private String domain;

    @JsonProperty("dnsallowoverride")
    private String dnsAllowOverride;

    @JsonProperty("group")
    private List<Group> group = new ArrayList<>();

    @JsonProperty("user")
    private List<User> user = new ArrayList<>();

    @JsonProperty("nextuid")
    private String nextUid;

    @JsonProperty("nextgid")
    private String nextGid;

    @JsonProperty("timezone")
    private String timezone;

    @JsonProperty("timeservers")
    private String timeservers;

    @JsonProperty("webgui")
    private Webgui webgui = new Webgui();

    @JsonProperty("disablenatreflection")
    private String disableNatReflection;

    @JsonProperty("usevirtualterminal")
    private String useVirtualTerminal;

    @JsonProperty("disableconsolemenu")
    private PresenceFlag disableConsoleMenu;

    @JsonProperty("disablevlanhwfilter")
    private String disableVlanHwFilter;

    @JsonProperty("disablechecksumoffloading")
    private String disableChecksumOffloading;

    @JsonProperty("disablesegmentationoffloading")
    private String disableSegmentationOffloading;

    @JsonProperty("disablelargereceiveoffloading")
    private String disableLargeReceiveOffloading;

    @JsonProperty("ipv6allow")
    private PresenceFlag ipv6Allow;

    @JsonProperty("powerd_ac_mode")
    private String powerdAcMode;

    @JsonProperty("powerd_battery_mode")
    private String powerdBatteryMode;

    @JsonProperty("powerd_normal_mode")
    private String powerdNormalMode;

    @JsonProperty("bogons")
    private Bogons bogons = new Bogons();

    @JsonProperty("pf_share_forward")
    private String pfShareForward;

    @JsonProperty("lb_use_sticky")
    private String lbUseSticky;

    @JsonProperty("ssh")
    private Ssh ssh = new Ssh();

    @JsonProperty("rrdbackup")
    private String rrdBackup;

    @JsonProperty("netflowbackup")
    private String netflowBackup;

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Optimization", optimization);
        visitor.visit("Hostname", hostname);
        visitor.visit("Domain", domain);
        visitor.visit("DNSAllowOverride", dnsAllowOverride);
        visitor.visit("Group", group);
        visitor.visit("User", user);
        visitor.visit("NextUID", nextUid);
        visitor.visit("NextGID", nextGid);
        visitor.visit("Timezone", timezone);
        visitor.visit("Timeservers", timeservers);
        visitor.visit("Webgui", webgui);
        visitor.visit("DisableNATReflection", disableNatReflection);
        visitor.visit("UseVirtualTerminal", useVirtualTerminal);
        visitor.visit("DisableConsoleMenu", disableConsoleMenu);
        visitor.visit("DisableVLANHWFilter", disableVlanHwFilter);
        visitor.visit("DisableChecksumOffloading", disableChecksumOffloading);
        visitor.visit("DisableSegmentationOffloading", disableSegmentationOffloading);
        visitor.visit("DisableLargeReceiveOffloading", disableLargeReceiveOffloading);
        visitor.visit("IPv6Allow", ipv6Allow);
        visitor.visit("PowerdAcMode", powerdAcMode);
        visitor.visit("PowerdBatteryMode", powerdBatteryMode);
        visitor.visit("PowerdNormalMode", powerdNormalMode);
        visitor.visit("Bogons", bogons);
        visitor.visit("PfShareForward", pfShareForward);
        visitor.visit("LbUseSticky", lbUseSticky);
        visitor.visit("SSH", ssh);
        visitor.visit("RrdBackup", rrdBackup);
        visitor.visit("NetflowBackup", netflowBackup);
    }
}
