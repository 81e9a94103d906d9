package com.yerin.notifyq.infra;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

public final class WorkerId {
    private WorkerId() {}

    public static String consumerName(String prefix, int index) {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "worker";
        }
        return prefix + "-" + host + "-" + UUID.randomUUID().toString().substring(0, 8) + "-" + index;
    }
}
