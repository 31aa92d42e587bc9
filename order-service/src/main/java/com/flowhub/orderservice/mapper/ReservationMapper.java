package com.flowhub.orderservice.mapper;

import com.flowhub.orderservice.dto.AllocationRequest;
import com.flowhub.orderservice.dto.OrderLineRequest;
import com.flowhub.orderservice.dto.ReservationResponse;
import com.flowhub.orderservice.model.FulfillmentOrder;
import com.flowhub.orderservice.model.OrderLine;
import com.flowhub.orderservice.model.Reservation;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ReservationMapper {

    // Field names match one to one, items are copied as a new list
    ReservationResponse toReservationResponse(Reservation reservation);

    @Mapping(target = "deliveryLocation.latitude", source = "latitude")
    @Mapping(target = "deliveryLocation.longitude", source = "longitude")
    FulfillmentOrder toFulfillmentOrder(AllocationRequest request);

    OrderLine toOrderLine(OrderLineRequest request);
}
