package com.supergrid.trader.controller;

import com.supergrid.trader.controller.dto.BarRequest;
import com.supergrid.trader.controller.dto.EvaluationResponse;
import com.supergrid.trader.controller.dto.FillRequest;
import com.supergrid.trader.controller.dto.GridStartRequest;
import com.supergrid.trader.controller.dto.GridStatusResponse;
import com.supergrid.trader.controller.dto.OrderUpdateRequest;
import com.supergrid.trader.controller.dto.PositionSyncRequest;
import com.supergrid.trader.controller.dto.TickRequest;
import com.supergrid.trader.service.GridTradingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for the grid lifecycle and its event feed.
 */
@RestController
@RequestMapping("/grid")
@RequiredArgsConstructor
@Slf4j
public class GridController {

    private final GridTradingService gridTradingService;

    /**
     * Start a grid.
     *
     * @param request the grid settings
     * @return the status of the started grid
     */
    @PostMapping
    public ResponseEntity<GridStatusResponse> startGrid(@Valid @RequestBody GridStartRequest request) {

        log.info("POST /grid - Settings: {}", request.getSettings());

        GridStatusResponse response = gridTradingService.start(request.getSettings());

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<GridStatusResponse> getStatus() {
        return ResponseEntity.ok(gridTradingService.getStatus());
    }

    /**
     * Stop the grid and cancel its working orders.
     */
    @DeleteMapping
    public ResponseEntity<GridStatusResponse> stopGrid() {

        log.info("DELETE /grid - Stopping grid");

        return ResponseEntity.ok(gridTradingService.stop());
    }

    /**
     * Feed a market tick and return the orders the grid sent for it.
     */
    @PostMapping("/ticks")
    public ResponseEntity<EvaluationResponse> submitTick(@Valid @RequestBody TickRequest request) {

        log.debug("POST /grid/ticks - Last: {}, Bid: {}, Ask: {}",
                request.getLastPrice(), request.getBidPrice(), request.getAskPrice());

        return ResponseEntity.ok(gridTradingService.onTick(request.toTickData()));
    }

    @PostMapping("/bars")
    public ResponseEntity<EvaluationResponse> submitBar(@Valid @RequestBody BarRequest request) {

        log.debug("POST /grid/bars - Close: {}", request.getClose());

        return ResponseEntity.ok(gridTradingService.onBar(request.toBarData()));
    }

    @PostMapping("/fills")
    public ResponseEntity<GridStatusResponse> submitFill(@Valid @RequestBody FillRequest request) {

        log.info("POST /grid/fills - Order: {}, {} {} @ {}", request.getOrderId(),
                request.getDirection(), request.getVolume(), request.getPrice());

        return ResponseEntity.ok(gridTradingService.onFill(request.toFill()));
    }

    @PostMapping("/order-updates")
    public ResponseEntity<GridStatusResponse> submitOrderUpdate(@Valid @RequestBody OrderUpdateRequest request) {

        log.info("POST /grid/order-updates - Order: {}, active: {}, status: {}",
                request.getOrderId(), request.getActive(), request.getStatus());

        return ResponseEntity.ok(gridTradingService.onOrderUpdate(request.toOrderUpdate()));
    }

    /**
     * Overwrite the grid position with the venue's figure.
     */
    @PostMapping("/position")
    public ResponseEntity<GridStatusResponse> syncPosition(@Valid @RequestBody PositionSyncRequest request) {

        log.info("POST /grid/position - Volume: {}, Price: {}", request.getVolume(), request.getPrice());

        return ResponseEntity.ok(gridTradingService.onPosition(request.toPositionSync()));
    }
}
