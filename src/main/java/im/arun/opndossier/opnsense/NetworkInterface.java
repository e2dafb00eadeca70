package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.Walkable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One assigned network interface.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NetworkInterface implements Walkable {

    @JsonProperty("enable")
    private String enable;

    @JsonProperty("if")
    private String device;

    @JsonProperty("mtu")
    private String mtu;

    @JsonProperty("ipaddr")
    private String ipAddr;

    @JsonProperty("ipaddrv6")
    private String ipAddrV6;

    @JsonProperty("subnet")
    private String subnet;

    @JsonProperty("subnetv6")
    private String subnetV6;

    @JsonProperty("gateway")
    private String gateway;

    @JsonProperty("blockpriv")
    private String blockPriv;

    @JsonProperty("blockbogons")
    private String blockBogons;

    @JsonProperty("dhcphostname")
    private String dhcpHostname;

    @JsonProperty("media")
    private String media;

    @JsonProperty("mediaopt")
    private String mediaOpt;

    @JsonProperty("dhcp6-ia-pd-len")
    private String dhcp6IaPdLen;

    @JsonProperty("track6-interface")
    private String track6Interface;

    @JsonProperty("track6-prefix-id")
    private String track6PrefixId;

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Enable", enable);
        visitor.visit("If", device);
        visitor.visit("MTU", mtu);
        visitor.visit("IPAddr", ipAddr);
        visitor.visit("IPAddrv6", ipAddrV6);
        visitor.visit("Subnet", subnet);
        visitor.visit("Subnetv6", subnetV6);
        visitor.visit("Gateway", gateway);
        visitor.visit("BlockPriv", blockPriv);
        visitor.visit("BlockBogons", blockBogons);
        visitor.visit("DHCPHostname", dhcpHostname);
        visitor.visit("Media", media);
        visitor.visit("MediaOpt", mediaOpt);
        visitor.visit("DHCP6IaPdLen", dhcp6IaPdLen);
        visitor.visit("Track6Interface", track6Interface);
        visitor.visit("Track6PrefixID", track6PrefixId);
    }
}
