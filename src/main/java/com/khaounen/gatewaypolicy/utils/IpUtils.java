package com.khaounen.gatewaypolicy.utils;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

public class IpUtils {

    private static final String[] FORWARDING_HEADERS = {
            "X-Forwarded-For",
            "X-Real-IP",
            "CF-Connecting-IP",
            "True-Client-IP"
    };

    private IpUtils() {
    }

    /**
     * First address of the first forwarding header that carries one, else the socket peer.
     */
    public static String resolveIp(HttpServletRequest request) {
        for (String header : FORWARDING_HEADERS) {
            String value = request.getHeader(header);
            if (!StringUtils.hasText(value)) {
                continue;
            }
            String first = value.split(",")[0].trim();
            if (StringUtils.hasText(first) && !"unknown".equalsIgnoreCase(first)) {
                return first;
            }
        }

        return request.getRemoteAddr();
    }
}
