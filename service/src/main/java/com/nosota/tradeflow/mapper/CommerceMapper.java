package com.nosota.tradeflow.mapper;

import com.nosota.tradeflow.api.request.DesignFilePayload;
import com.nosota.tradeflow.api.response.BookingResponse;
import com.nosota.tradeflow.api.response.DesignApprovalResponse;
import com.nosota.tradeflow.api.response.DesignFileResponse;
import com.nosota.tradeflow.api.response.LedgerEntryResponse;
import com.nosota.tradeflow.api.response.OrderResponse;
import com.nosota.tradeflow.api.response.QuoteResponse;
import com.nosota.tradeflow.api.response.ReturnRequestResponse;
import com.nosota.tradeflow.model.Booking;
import com.nosota.tradeflow.model.DesignApproval;
import com.nosota.tradeflow.model.DesignFile;
import com.nosota.tradeflow.model.LedgerEntry;
import com.nosota.tradeflow.model.Order;
import com.nosota.tradeflow.model.Quote;
import com.nosota.tradeflow.model.ReturnRequest;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for the negotiation and fulfillment entities.
 */
@Mapper
public interface CommerceMapper {

    CommerceMapper INSTANCE = Mappers.getMapper(CommerceMapper.class);

    QuoteResponse toResponse(Quote quote);

    List<QuoteResponse> toQuoteResponseList(List<Quote> quotes);

    DesignApprovalResponse toResponse(DesignApproval designApproval);

    List<DesignApprovalResponse> toDesignApprovalResponseList(List<DesignApproval> designApprovals);

    DesignFileResponse toDesignFileResponse(DesignFile designFile);

    DesignFile toDesignFile(DesignFilePayload payload);

    List<DesignFile> toDesignFiles(List<DesignFilePayload> payloads);

    OrderResponse toResponse(Order order);

    BookingResponse toResponse(Booking booking);

    ReturnRequestResponse toResponse(ReturnRequest returnRequest);

    List<ReturnRequestResponse> toReturnResponseList(List<ReturnRequest> returnRequests);

    LedgerEntryResponse toResponse(LedgerEntry entry);

    List<LedgerEntryResponse> toLedgerResponseList(List<LedgerEntry> entries);
}
