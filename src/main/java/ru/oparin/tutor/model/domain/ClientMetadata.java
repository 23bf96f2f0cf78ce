package ru.oparin.tutor.model.domain;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Данные клиента, выпустившего сессию. Оба поля необязательны.
 */
@Value
@AllArgsConstructor(staticName = "of")
public class ClientMetadata {

    String userAgent;

    String ipAddress;

    public static ClientMetadata empty() {
        return new ClientMetadata(null, null);
    }
}
