package com.example.linguarelay.controller;

import com.example.linguarelay.model.TranslationDirection;
import com.example.linguarelay.service.RoomStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.stream.Collectors;

/** Control plane: create a room, check whether a code is live. */
@RestController
@RequestMapping("/api")
public class RoomController {

  private final RoomStore store;

  public RoomController(RoomStore store) {
    this.store = store;
  }

  @PostMapping("/create-room")
  public ResponseEntity<?> createRoom(@Valid @RequestBody CreateRoomRequest body) {
    var direction = TranslationDirection.parse(body.translationDirection).orElse(null);
    if (direction == null) {
      return ResponseEntity.badRequest().body(new ErrorView(
          "Unknown translationDirection '" + body.translationDirection + "', expected one of " + allowedDirections()));
    }
    return ResponseEntity.ok(new CreatedView(store.createRoom(direction)));
  }

  @GetMapping("/check-room/{roomCode}")
  public ExistsView checkRoom(@PathVariable String roomCode) {
    return new ExistsView(store.exists(roomCode));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorView> invalid(MethodArgumentNotValidException e) {
    return ResponseEntity.badRequest().body(new ErrorView("translationDirection is required, expected one of " + allowedDirections()));
  }

  private static String allowedDirections() {
    return Arrays.stream(TranslationDirection.values())
        .map(TranslationDirection::wireValue)
        .collect(Collectors.joining(", "));
  }

  // ===== DTOs (Views/Requests) ============================================

  /** POST create-room body */
  public static final class CreateRoomRequest {
    @NotBlank
    public String translationDirection;
  }

  public static final class CreatedView {
    public String roomCode;
    public CreatedView(String roomCode) { this.roomCode = roomCode; }
  }

  /** GET check-room view */
  public static final class ExistsView {
    public boolean exists;
    public ExistsView(boolean exists) { this.exists = exists; }
  }

  /** Error view (compact) */
  public static final class ErrorView {
    public boolean ok = false;
    public String message;
    public ErrorView(String message) {
      this.message = (message == null ? "Internal error" : message);
    }
  }
}
