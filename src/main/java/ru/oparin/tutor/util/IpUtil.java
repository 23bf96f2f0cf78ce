package ru.oparin.tutor.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.server.ServerWebExchange;
import ru.oparin.tutor.model.domain.ClientMetadata;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Утилита для работы с IP адресами в WebFlux.
 */
@Slf4j
@UtilityClass
public class IpUtil {

    private static final int MAX_USER_AGENT_LENGTH = 500;

    /**
     * Длина самой длинной текстовой записи IPv6 (с вложенным IPv4).
     */
    private static final int MAX_IP_LENGTH = 45;

    private static final Pattern IPV4 = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");

    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9a-fA-F:.]+$");

    /**
     * Извлекает IP адрес клиента из запроса.
     * X-Forwarded-For и X-Real-IP учитываются, только если запрос пришел от доверенного прокси.
     * В X-Forwarded-For берется самый правый адрес, не принадлежащий доверенным прокси:
     * его дописал ближайший к нам прокси, а адреса левее клиент мог подставить сам.
     *
     * @param exchange       ServerWebExchange для получения информации о запросе
     * @param trustedProxies адреса доверенных прокси
     * @return IP адрес клиента или пустой Optional, если адрес определить не удалось
     */
    public static Optional<String> extractClientIp(ServerWebExchange exchange, Collection<String> trustedProxies) {
        Optional<String> remoteIp = remoteIp(exchange);
        Set<String> trusted = normalizeAll(trustedProxies);

        if (remoteIp.isPresent() && trusted.contains(remoteIp.get())) {
            String forwardedFor = exchange.getRequest().getHeaders().getFirst("X-Forwarded-For");
            if (forwardedFor != null && !forwardedFor.isBlank()) {
                String[] hops = forwardedFor.split(",");
                for (int i = hops.length - 1; i >= 0; i--) {
                    Optional<String> hop = normalize(hops[i]);
                    if (hop.isEmpty()) {
                        log.warn("Некорректный адрес в X-Forwarded-For, используется адрес соединения {}", remoteIp.get());
                        return remoteIp;
                    }
                    if (!trusted.contains(hop.get())) {
                        return hop;
                    }
                }
            }

            Optional<String> realIp = normalize(exchange.getRequest().getHeaders().getFirst("X-Real-IP"));
            if (realIp.isPresent()) {
                return realIp;
            }
        }

        if (remoteIp.isEmpty()) {
            log.warn("Не удалось определить IP адрес клиента. URI: {}", exchange.getRequest().getURI());
        }
        return remoteIp;
    }

    /**
     * Собирает метаданные клиента (User-Agent и IP) для записи сессии.
     */
    public static ClientMetadata extractClientMetadata(ServerWebExchange exchange, Collection<String> trustedProxies) {
        String userAgent = exchange.getRequest().getHeaders().getFirst(HttpHeaders.USER_AGENT);
        if (userAgent != null && userAgent.length() > MAX_USER_AGENT_LENGTH) {
            userAgent = userAgent.substring(0, MAX_USER_AGENT_LENGTH);
        }
        return ClientMetadata.of(userAgent, extractClientIp(exchange, trustedProxies).orElse(null));
    }

    /**
     * Приводит текстовый IP адрес к каноническому виду.
     * Имена хостов не принимаются, поэтому разбор никогда не обращается к DNS.
     *
     * @return канонический адрес или пустой Optional, если строка не является IP адресом
     */
    public static Optional<String> normalize(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String candidate = value.trim();
        if (candidate.isEmpty() || candidate.length() > MAX_IP_LENGTH) {
            return Optional.empty();
        }
        if (IPV4.matcher(candidate).matches()) {
            return Optional.of(candidate);
        }
        if (candidate.indexOf(':') < 0 || !IPV6_CHARS.matcher(candidate).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(InetAddress.getByName(candidate).getHostAddress());
        } catch (UnknownHostException e) {
            log.debug("Строка {} не является IP адресом: {}", candidate, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<String> remoteIp(ServerWebExchange exchange) {
        InetSocketAddress remoteAddress = exchange.getRequest().getRemoteAddress();
        if (remoteAddress == null || remoteAddress.getAddress() == null) {
            return Optional.empty();
        }
        String hostAddress = remoteAddress.getAddress().getHostAddress();
        // Идентификатор зоны у link-local IPv6 (fe80::1%eth0) не является частью адреса
        int zoneIndex = hostAddress.indexOf('%');
        return normalize(zoneIndex >= 0 ? hostAddress.substring(0, zoneIndex) : hostAddress);
    }

    private static Set<String> normalizeAll(Collection<String> addresses) {
        if (addresses == null) {
            return Set.of();
        }
        return addresses.stream()
                .map(IpUtil::normalize)
                .flatMap(Optional::stream)
                .collect(Collectors.toSet());
    }
}
