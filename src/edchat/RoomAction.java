package edchat;

import java.util.List;

/**
 * Handler of one slash command in a room, e.g. {@code /gotoroom lounge}.
 */
@FunctionalInterface
interface RoomAction {

    /**
     * @param room    the room the command was typed in
     * @param session the issuing session
     * @param args    the tokens after the action name, at most five
     */
    void execute(RoomChatLogic room, ChatSession session, List<String> args);
}
