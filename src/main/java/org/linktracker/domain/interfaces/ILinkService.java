package org.linktracker.domain.interfaces;

import org.linktracker.domain.model.Activity;
import org.linktracker.domain.model.Link;
import org.linktracker.domain.model.LinkDraft;

import java.util.List;

public interface ILinkService {
    List<Link> listLinks();                       // newest first
    Link addLink(LinkDraft draft);
    Link updateLink(String id, LinkDraft draft);  // LinkNotFoundException if absent
    Link deleteLink(String id);                   // returns the removed link
    int click(String id);                         // returns the new click count
    List<Activity> activities();                  // most recent first
}
