package uk.gegc.adaptivetest.features.pool.infra.factory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.adaptivetest.features.pool.domain.model.ItemType;
import uk.gegc.adaptivetest.features.pool.infra.handler.ItemHandler;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class ItemHandlerFactory {
    private final Map<ItemType, ItemHandler> handlerMap = new EnumMap<>(ItemType.class);

    public ItemHandlerFactory(List<ItemHandler> handlers) {
        handlers.forEach(handler -> handlerMap.put(handler.supportedType(), handler));
        log.info("ItemHandlerFactory initialized with handlers for types: {}", handlerMap.keySet());
    }

    public ItemHandler getHandler(ItemType type) {
        ItemHandler handler = type == null ? null : handlerMap.get(type);
        if (handler == null) {
            throw new UnsupportedOperationException("No handler for item type " + type);
        }
        return handler;
    }
}
