package com.arkham.orders.domain;

import com.arkham.logging.event.WideEventBuilder;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Service;

/**
 * Places and looks up orders.
 *
 * <p>Callers pass the wide event of the surrounding operation; the inventory round trip is
 * attached to it as the {@code inventory} dependency. Orders live in memory.
 */
@Service
public class OrderService {

    static final String INVENTORY_DEPENDENCY = "inventory";

    private final InventoryGateway inventory;
    private final Clock clock;
    private final Map<String, Order> orders = new ConcurrentHashMap<>();

    public OrderService(InventoryGateway inventory, Clock clock) {
        this.inventory = inventory;
        this.clock = clock;
    }

    /**
     * Reserves stock and stores a confirmed order.
     *
     * @throws InsufficientStockException when the reservation is refused
     */
    public Order place(String customerId, String sku, int quantity, WideEventBuilder event) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive");
        }

        long started = System.nanoTime();
        boolean reserved = inventory.reserve(sku, quantity);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        event.dependency(INVENTORY_DEPENDENCY, elapsedMs, Map.of("sku", sku, "reserved", reserved));

        if (!reserved) {
            throw new InsufficientStockException(sku, quantity);
        }

        var order =
                new Order(
                        "ord_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16),
                        customerId,
                        sku,
                        quantity,
                        OrderStatus.CONFIRMED,
                        clock.instant());
        orders.put(order.id(), order);
        return order;
    }

    public Optional<Order> find(String orderId) {
        return Optional.ofNullable(orderId).map(orders::get);
    }

    /** Like {@link #find} but fails with {@link OrderNotFoundException}. */
    public Order get(String orderId) {
        return find(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
