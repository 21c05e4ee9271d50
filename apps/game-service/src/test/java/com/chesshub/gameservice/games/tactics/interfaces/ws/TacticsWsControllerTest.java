package com.chesshub.gameservice.games.tactics.interfaces.ws;

import com.chesshub.gameservice.games.tactics.domain.constants.TacticsMessages;
import com.chesshub.gameservice.games.tactics.domain.dto.BoardCodec;
import com.chesshub.gameservice.games.tactics.domain.model.Board;
import com.chesshub.gameservice.games.tactics.domain.model.ClickResult;
import com.chesshub.gameservice.games.tactics.domain.model.Piece;
import com.chesshub.gameservice.games.tactics.domain.model.PieceColor;
import com.chesshub.gameservice.games.tactics.domain.model.PieceKind;
import com.chesshub.gameservice.games.tactics.domain.model.Position;
import com.chesshub.gameservice.games.tactics.domain.model.TacticsState;
import com.chesshub.gameservice.games.tactics.interfaces.ws.dto.TacticsWsMessages;
import com.chesshub.gameservice.games.tactics.interfaces.ws.dto.TacticsWsMessages.BroadcastEvent;
import com.chesshub.gameservice.games.tactics.interfaces.ws.dto.TacticsWsMessages.ClickCmd;
import com.chesshub.gameservice.games.tactics.interfaces.ws.dto.TacticsWsMessages.GameOver;
import com.chesshub.gameservice.games.tactics.interfaces.ws.dto.TacticsWsMessages.GameStart;
import com.chesshub.gameservice.games.tactics.interfaces.ws.dto.TacticsWsMessages.OpponentMove;
import com.chesshub.gameservice.games.tactics.interfaces.ws.dto.TacticsWsMessages.ResultCmd;
import com.chesshub.gameservice.games.tactics.interfaces.ws.dto.TacticsWsMessages.RoomCmd;
import com.chesshub.gameservice.games.tactics.interfaces.ws.dto.TacticsWsMessages.SeatReply;
import com.chesshub.gameservice.games.tactics.interfaces.ws.dto.TacticsWsMessages.SelectionPayload;
import com.chesshub.gameservice.games.tactics.interfaces.ws.dto.TacticsWsMessages.StatePayload;
import com.chesshub.gameservice.games.tactics.interfaces.ws.dto.TacticsWsMessages.SubmitCmd;
import com.chesshub.gameservice.games.tactics.service.TacticsService;
import com.chesshub.gameservice.games.tactics.service.TacticsService.ClickReport;
import com.chesshub.gameservice.games.tactics.service.TacticsService.JoinResult;
import com.chesshub.gameservice.games.tactics.service.TacticsService.RelayResult;
import com.chesshub.gameservice.games.tactics.service.TacticsService.SeatGrant;
import com.chesshub.gameservice.platform.ws.ParticipantPrincipal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TacticsWsControllerTest {

    @Mock
    private TacticsService tacticsService;
    @Mock
    private SimpMessagingTemplate messaging;

    private TacticsWsController controller;

    @BeforeEach
    void setUp() {
        controller = new TacticsWsController(tacticsService, messaging);
    }

    @Test
    void shouldReplyToCreatorWithRoomAndColor() {
        when(tacticsService.createRoom("alice")).thenReturn(new SeatGrant("r1", PieceColor.WHITE));

        controller.create(as("alice"));

        verify(messaging).convertAndSendToUser("alice", TacticsWsController.Q_CREATED, new SeatReply("r1", "white"));
    }

    @Test
    void shouldCreateLocalRoom() {
        when(tacticsService.createLocalRoom("dave")).thenReturn(new SeatGrant("r9", PieceColor.WHITE));

        controller.local(as("dave"));

        verify(messaging).convertAndSendToUser("dave", TacticsWsController.Q_CREATED, new SeatReply("r9", "white"));
    }

    @Test
    void shouldAnnounceGameStartWhenBlackJoins() {
        when(tacticsService.joinRoom("r1", "bob"))
                .thenReturn(new JoinResult("r1", PieceColor.BLACK, "alice", "bob"));

        controller.join(roomCmd("r1"), as("bob"));

        verify(messaging).convertAndSendToUser("bob", TacticsWsController.Q_JOINED, new SeatReply("r1", "black"));
        BroadcastEvent evt = captureBroadcast("r1");
        assertEquals(TacticsWsMessages.GAME_START, evt.getType());
        assertEquals(new GameStart("alice", "bob"), evt.getPayload());
    }

    @Test
    void shouldTellOnlyTheJoinerWhenRoomIsFull() {
        when(tacticsService.joinRoom("r1", "carol"))
                .thenThrow(new IllegalStateException(TacticsMessages.ROOM_NOT_FOUND_OR_FULL));

        controller.join(roomCmd("r1"), as("carol"));

        BroadcastEvent err = captureError("carol");
        assertEquals(TacticsWsMessages.ERROR, err.getType());
        assertEquals(TacticsMessages.ROOM_NOT_FOUND_OR_FULL, err.getPayload());
        verify(messaging, never()).convertAndSend(anyString(), any(Object.class));
    }

    @Test
    void shouldForwardSubmittedBoardToOpponentOnly() {
        Board next = Board.initial().withPieceMoved(Position.of(7, 3), Position.of(4, 3));
        when(tacticsService.submitAction("r1", "alice", next, PieceColor.BLACK))
                .thenReturn(new RelayResult(true, "bob"));

        SubmitCmd cmd = new SubmitCmd();
        cmd.setRoomId("r1");
        cmd.setBoard(BoardCodec.encode(next));
        cmd.setCurrentPlayer("black");
        controller.submit(cmd, as("alice"));

        ArgumentCaptor<BroadcastEvent> captor = ArgumentCaptor.forClass(BroadcastEvent.class);
        verify(messaging).convertAndSendToUser(eq("bob"), eq(TacticsWsController.Q_EVENTS), captor.capture());
        assertEquals(TacticsWsMessages.OPPONENT_MOVE, captor.getValue().getType());
        OpponentMove move = (OpponentMove) captor.getValue().getPayload();
        assertEquals("black", move.getCurrentPlayer());
        assertEquals(BoardCodec.encode(next), move.getBoard());
        verify(messaging, never()).convertAndSend(anyString(), any(Object.class));
    }

    @Test
    void shouldDropSubmissionAfterGameIsOver() {
        when(tacticsService.submitAction(eq("r1"), eq("alice"), any(Board.class), eq(PieceColor.BLACK)))
                .thenReturn(new RelayResult(false, null));

        SubmitCmd cmd = new SubmitCmd();
        cmd.setRoomId("r1");
        cmd.setBoard(BoardCodec.encode(Board.initial()));
        cmd.setCurrentPlayer("black");
        controller.submit(cmd, as("alice"));

        verify(messaging, never()).convertAndSendToUser(anyString(), anyString(), any(Object.class));
    }

    @Test
    void shouldReportMalformedBoardToSender() {
        SubmitCmd cmd = new SubmitCmd();
        cmd.setRoomId("r1");
        cmd.setBoard(new ArrayList<>());
        cmd.setCurrentPlayer("black");

        controller.submit(cmd, as("alice"));

        assertEquals(TacticsMessages.MALFORMED_BOARD, captureError("alice").getPayload());
        verify(tacticsService, never()).submitAction(anyString(), anyString(), any(), any());
    }

    @Test
    void shouldBroadcastAnnouncedResult() {
        when(tacticsService.announceResult("r1", "bob", PieceColor.BLACK)).thenReturn(PieceColor.BLACK);

        ResultCmd cmd = new ResultCmd();
        cmd.setRoomId("r1");
        cmd.setWinner("black");
        controller.result(cmd, as("bob"));

        BroadcastEvent evt = captureBroadcast("r1");
        assertEquals(TacticsWsMessages.GAME_OVER, evt.getType());
        assertEquals(new GameOver("black"), evt.getPayload());
    }

    @Test
    void shouldBroadcastSelectionSetsAfterSelecting() {
        TacticsState s = new TacticsState();
        s.click(Position.of(7, 3));
        when(tacticsService.click("r1", "alice", Position.of(7, 3)))
                .thenReturn(new ClickReport(ClickResult.SELECTED, s));

        controller.click(clickCmd("r1", 7, 3), as("alice"));

        BroadcastEvent evt = captureBroadcast("r1");
        assertEquals(TacticsWsMessages.SELECTION, evt.getType());
        SelectionPayload payload = (SelectionPayload) evt.getPayload();
        assertEquals(Position.of(7, 3), payload.getOrigin());
        assertEquals(List.of(Position.of(4, 3), Position.of(5, 3), Position.of(6, 3)), payload.getMoves());
        assertTrue(payload.getAttacks().isEmpty());
    }

    @Test
    void shouldBroadcastStateAndGameOverOnKingCapture() {
        TacticsState s = new TacticsState();
        s.replaceFromRemote(Board.empty()
                .withPiece(Position.of(4, 4), Piece.of(PieceKind.PALADIN, PieceColor.WHITE))
                .withPiece(Position.of(2, 2), Piece.of(PieceKind.KING, PieceColor.BLACK)), PieceColor.WHITE);
        s.click(Position.of(4, 4));
        s.click(Position.of(2, 2));
        when(tacticsService.click("r1", "alice", Position.of(2, 2)))
                .thenReturn(new ClickReport(ClickResult.CAPTURED, s));

        controller.click(clickCmd("r1", 2, 2), as("alice"));

        ArgumentCaptor<BroadcastEvent> captor = ArgumentCaptor.forClass(BroadcastEvent.class);
        verify(messaging, times(2)).convertAndSend(eq("/topic/room.r1"), captor.capture());
        List<BroadcastEvent> events = captor.getAllValues();
        assertEquals(TacticsWsMessages.STATE, events.get(0).getType());
        StatePayload state = (StatePayload) events.get(0).getPayload();
        assertEquals("white", state.getWinner());
        assertEquals("white", state.getCurrentPlayer());
        assertEquals(TacticsWsMessages.GAME_OVER, events.get(1).getType());
    }

    @Test
    void shouldStayQuietOnIgnoredClick() {
        when(tacticsService.click("r1", "bob", Position.of(0, 0)))
                .thenReturn(new ClickReport(ClickResult.IGNORED, new TacticsState()));

        controller.click(clickCmd("r1", 0, 0), as("bob"));

        verify(messaging, never()).convertAndSend(anyString(), any(Object.class));
        verify(messaging, never()).convertAndSendToUser(anyString(), anyString(), any(Object.class));
    }

    @Test
    void shouldClearHighlightsWhenSelectionIsDropped() {
        when(tacticsService.click("r1", "alice", Position.of(0, 0)))
                .thenReturn(new ClickReport(ClickResult.CLEARED, new TacticsState()));

        controller.click(clickCmd("r1", 0, 0), as("alice"));

        SelectionPayload payload = (SelectionPayload) captureBroadcast("r1").getPayload();
        assertNull(payload.getOrigin());
        assertTrue(payload.getMoves().isEmpty());
    }

    @Test
    void shouldBroadcastFreshStateOnReset() {
        when(tacticsService.reset("r1", "alice")).thenReturn(new TacticsState());

        controller.reset(roomCmd("r1"), as("alice"));

        BroadcastEvent evt = captureBroadcast("r1");
        assertEquals(TacticsWsMessages.STATE, evt.getType());
        StatePayload state = (StatePayload) evt.getPayload();
        assertEquals(BoardCodec.encode(Board.initial()), state.getBoard());
        assertNull(state.getWinner());
    }

    // ----------- helpers -----------

    private static SimpMessageHeaderAccessor as(String user) {
        SimpMessageHeaderAccessor sha = SimpMessageHeaderAccessor.create();
        sha.setUser(new ParticipantPrincipal(user));
        return sha;
    }

    private static RoomCmd roomCmd(String roomId) {
        RoomCmd cmd = new RoomCmd();
        cmd.setRoomId(roomId);
        return cmd;
    }

    private static ClickCmd clickCmd(String roomId, int row, int col) {
        ClickCmd cmd = new ClickCmd();
        cmd.setRoomId(roomId);
        cmd.setRow(row);
        cmd.setCol(col);
        return cmd;
    }

    private BroadcastEvent captureBroadcast(String roomId) {
        ArgumentCaptor<BroadcastEvent> captor = ArgumentCaptor.forClass(BroadcastEvent.class);
        verify(messaging).convertAndSend(eq("/topic/room." + roomId), captor.capture());
        return captor.getValue();
    }

    private BroadcastEvent captureError(String user) {
        ArgumentCaptor<BroadcastEvent> captor = ArgumentCaptor.forClass(BroadcastEvent.class);
        verify(messaging).convertAndSendToUser(eq(user), eq(TacticsWsController.Q_ERROR), captor.capture());
        return captor.getValue();
    }
}
