package im.arun.opndossier;

import im.arun.opndossier.opnsense.MonitorOptions;
import im.arun.opndossier.opnsense.MonitorType;
import im.arun.opndossier.opnsense.NetworkInterface;
import im.arun.opndossier.opnsense.Opnsense;
import im.arun.opndossier.opnsense.Range;
import im.arun.opndossier.opnsense.Rule;
import im.arun.opndossier.opnsense.SysctlItem;
import im.arun.opndossier.opnsense.User;
import im.arun.opndossier.opnsense.Webgui;
import im.arun.opndossier.tree.PresenceFlag;

/**
 * Configuration fixtures shared by the tests.
 */
public final class TestConfigurations {

    private TestConfigurations() {
    }

    public static Opnsense minimal() {
        Opnsense opnsense = new Opnsense();
        opnsense.setVersion("1.0");
        opnsense.getSystem().setHostname("firewall.local");
        opnsense.getSystem().setDomain("example.com");
        return opnsense;
    }

    public static NetworkInterface networkInterface(String device, String ipAddr, String subnet) {
        NetworkInterface iface = new NetworkInterface();
        iface.setDevice(device);
        iface.setIpAddr(ipAddr);
        iface.setSubnet(subnet);
        return iface;
    }

    /**
     * A configuration touching every section of the schema.
     */
    public static Opnsense full() {
        Opnsense opnsense = minimal();
        opnsense.setTriggerInitialWizard(PresenceFlag.PRESENT);
        opnsense.setTheme("opnsense");

        opnsense.getSysctl().add(new SysctlItem("TCP RFC 3390", "net.inet.tcp.rfc3390", "1"));
        opnsense.getSysctl().add(new SysctlItem("Maximum socket buffer size", "kern.ipc.maxsockbuf", "16777216"));

        opnsense.getSystem().setOptimization("normal");
        opnsense.getSystem().setTimezone("Etc/UTC");
        opnsense.getSystem().setWebgui(new Webgui("https"));
        opnsense.getSystem().setDisableConsoleMenu(PresenceFlag.PRESENT);
        opnsense.getSystem().setIpv6Allow(PresenceFlag.PRESENT);
        opnsense.getSystem().getUser().add(new User("root", "System Administrator", "system", "admins", "$2y$10$hash", "0"));
        opnsense.getSystem().getSsh().setGroup("admins");

        opnsense.getInterfaces().getItems().put("wan", networkInterface("em0", "dhcp", ""));
        opnsense.getInterfaces().getItems().put("lan", networkInterface("em1", "192.168.1.1", "24"));

        opnsense.getDhcpd().getLan().setEnable("1");
        opnsense.getDhcpd().getLan().setRange(new Range("192.168.1.100", "192.168.1.199"));

        opnsense.getUnbound().setEnable("1");
        opnsense.getSnmpd().setRoCommunity("public");
        opnsense.getNat().getOutbound().setMode("automatic");

        Rule rule = new Rule();
        rule.setType("pass");
        rule.setIpProtocol("inet");
        rule.setDescr("Allow LAN to any rule");
        rule.setIface("lan");
        rule.getSource().setNetwork("lan");
        rule.getDestination().setAny(PresenceFlag.PRESENT);
        opnsense.getFilter().getRule().add(rule);

        opnsense.getRrd().setEnable(PresenceFlag.PRESENT);

        MonitorType monitor = new MonitorType();
        monitor.setName("HTTP");
        monitor.setType("http");
        monitor.setDescr("HTTP");
        monitor.setOptions(new MonitorOptions("/", "", "200", "", ""));
        opnsense.getLoadBalancer().getMonitorType().add(monitor);

        opnsense.getNtpd().setPrefer("0.opnsense.pool.ntp.org");
        opnsense.getWidgets().setColumnCount("2");
        return opnsense;
    }
}
