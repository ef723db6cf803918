/** Local draft text for the block being edited. */
package express.mvp.blocksync.draft;
