package org.nowstart.tradeguard.service.alert;

import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class LoggingAlertService implements AlertService {

    @Override
    public void notify(String title, String message, Map<String, Object> context) {
        log.warn("event=alert title=\"{}\" message=\"{}\" context={}", title, message, new TreeMap<>(context));
    }
}
