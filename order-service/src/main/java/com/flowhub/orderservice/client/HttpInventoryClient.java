package com.flowhub.orderservice.client;

import com.flowhub.common.dto.ReservationAck;
import com.flowhub.common.dto.ReserveStockRequest;
import com.flowhub.common.exception.StockRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Component
@Slf4j
public class HttpInventoryClient implements InventoryClient {

    private final WebClient inventoryWebClient;

    public HttpInventoryClient(@Qualifier("inventoryWebClient") WebClient inventoryWebClient) {
        this.inventoryWebClient = inventoryWebClient;
    }

    @Override
    public Mono<ReservationAck> reserve(ReserveStockRequest request) {
        return inventoryWebClient.post()
                .uri("/reservations")
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpInventoryClient::isRejection, response -> rejection(response,
                        "Inventory rejected reservation " + request.getReservationId()))
                .bodyToMono(ReservationAck.class)
                .defaultIfEmpty(ack(request.getReservationId(), "reserved"))
                .flatMap(ack -> {
                    if (ack.isRejected()) {
                        return Mono.error(new StockRejectedException("Inventory rejected reservation "
                                + request.getReservationId() + ": " + ack.getReason()));
                    }
                    log.debug("Inventory accepted reservation. reservationId={}, locationId={}",
                            request.getReservationId(), request.getLocationId());
                    return Mono.just(ack);
                });
    }

    @Override
    public Mono<ReservationAck> release(UUID reservationId) {
        return inventoryWebClient.post()
                .uri("/reservations/{id}/release", reservationId)
                .exchangeToMono(response -> {
                    if (response.statusCode().value() == 404) {
                        log.debug("Inventory does not know reservation, treating as released. reservationId={}",
                                reservationId);
                        return response.releaseBody().thenReturn(ack(reservationId, "released"));
                    }
                    if (response.statusCode().isError()) {
                        return response.createException().flatMap(Mono::error);
                    }
                    return response.bodyToMono(ReservationAck.class).defaultIfEmpty(ack(reservationId, "released"));
                });
    }

    @Override
    public Mono<ReservationAck> confirm(UUID reservationId) {
        return inventoryWebClient.post()
                .uri("/reservations/{id}/confirm", reservationId)
                .retrieve()
                .onStatus(HttpInventoryClient::isRejection, response -> rejection(response,
                        "Inventory refused to confirm reservation " + reservationId))
                .bodyToMono(ReservationAck.class)
                .defaultIfEmpty(ack(reservationId, "confirmed"))
                .flatMap(ack -> ack.isRejected()
                        ? Mono.error(new StockRejectedException("Inventory refused to confirm reservation "
                                + reservationId + ": " + ack.getReason()))
                        : Mono.just(ack));
    }

    private static boolean isRejection(HttpStatusCode status) {
        return status.value() == 409 || status.value() == 422;
    }

    private static Mono<StockRejectedException> rejection(ClientResponse response, String message) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new StockRejectedException(body.isBlank() ? message : message + ": " + body));
    }

    private static ReservationAck ack(UUID reservationId, String status) {
        return ReservationAck.builder().reservationId(reservationId).status(status).build();
    }
}
