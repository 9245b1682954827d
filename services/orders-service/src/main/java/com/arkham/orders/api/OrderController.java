package com.arkham.orders.api;

import com.arkham.logging.operation.OperationLogger;
import com.arkham.orders.domain.Order;
import com.arkham.orders.domain.OrderService;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Order endpoints. Each request runs as one operation and so produces exactly one wide event:
 * {@code orders.create} or {@code orders.get}.
 */
@RestController
@RequestMapping("/api/v1/orders")
public class OrderController {

    static final String CREATE_OPERATION = "orders.create";
    static final String GET_OPERATION = "orders.get";

    private final OrderService orderService;
    private final OperationLogger operations;

    public OrderController(OrderService orderService, OperationLogger operations) {
        this.orderService = orderService;
        this.operations = operations;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public OrderResponse create(@Valid @RequestBody CreateOrderRequest request) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("sku", request.sku());
        context.put("quantity", request.quantity());
        if (request.customerEmail() != null) {
            context.put("customer_email", request.customerEmail());
        }

        return operations.supply(
                CREATE_OPERATION,
                context,
                event -> {
                    event.user("id", request.customerId());
                    Order order =
                            orderService.place(
                                    request.customerId(), request.sku(), request.quantity(), event);
                    event.output("order_id", order.id());
                    event.output("status", order.status().wireName());
                    event.statusCode(HttpStatus.CREATED.value());
                    return OrderResponse.from(order);
                });
    }

    @GetMapping("/{orderId}")
    public OrderResponse get(@PathVariable String orderId) {
        return operations.supply(
                GET_OPERATION,
                Map.of("order_id", orderId),
                event -> {
                    Order order = orderService.get(orderId);
                    event.output("status", order.status().wireName());
                    event.statusCode(HttpStatus.OK.value());
                    return OrderResponse.from(order);
                });
    }
}
